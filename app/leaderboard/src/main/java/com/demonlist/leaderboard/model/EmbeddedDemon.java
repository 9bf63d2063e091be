package com.demonlist.leaderboard.model;

public record EmbeddedDemon(String name, int position) {}
