package com.demonlist.leaderboard.submission;

import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.PlayerRecord;

public record ResolvedSubmission(PlayerRecord player, DemonRecord demon) {}
