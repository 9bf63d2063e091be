package com.demonlist.leaderboard.model;

public record Registration(String name, String password) {

    @Override
    public String toString() {
        return "Registration[name=" + name + "]";
    }
}
