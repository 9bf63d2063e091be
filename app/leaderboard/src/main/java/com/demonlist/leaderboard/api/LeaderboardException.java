package com.demonlist.leaderboard.api;

public class LeaderboardException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ApiErrorCode code;

  public LeaderboardException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public LeaderboardException(ApiErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ApiErrorCode code() {
    return code;
  }

  public static LeaderboardException unauthorized() {
    return new LeaderboardException(ApiErrorCode.UNAUTHORIZED, "authorization required");
  }

  // 呼び出し側の実装ミスを表す。クライアント起因ではない
  public static LeaderboardException invalidState(String message) {
    return new LeaderboardException(ApiErrorCode.INVALID_STATE, message);
  }
}
