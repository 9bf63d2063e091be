package com.demonlist.leaderboard.model;

public record NewDemon(
        String name,
        int position,
        int requirement,
        String video,
        String verifier,
        String publisher) {
}
