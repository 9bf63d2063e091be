package com.demonlist.leaderboard.api;

public class ConnectionUnavailableException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  public ConnectionUnavailableException(Throwable cause) {
    super(ApiErrorCode.CONNECTION_UNAVAILABLE, "no database connection available", cause);
  }
}
