package com.demonlist.leaderboard.api;

public class InvalidProgressException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  private final int requirement;

  public InvalidProgressException(int requirement) {
    super(
        ApiErrorCode.INVALID_PROGRESS,
        "progress must be between " + requirement + " and 100 (inclusive)");
    this.requirement = requirement;
  }

  public int requirement() {
    return requirement;
  }
}
