package com.demonlist.leaderboard.api;

// ドライバ/Spring の例外をそのまま呼び出し側へ漏らさないためのラッパ
public class DatabaseException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  public DatabaseException(Throwable cause) {
    super(ApiErrorCode.DATABASE_ERROR, "database operation failed", cause);
  }
}
