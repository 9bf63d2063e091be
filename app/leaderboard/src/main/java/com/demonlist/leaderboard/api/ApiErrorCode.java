/*
 * どこで: Leaderboard コアのエラー定義
 * 何を: コマンドが失敗した理由をコードで区別する
 * なぜ: 呼び出し側(HTTP 層など)が同じ例外型でも原因ごとに応答を変えられるようにするため
 */
package com.demonlist.leaderboard.api;

public enum ApiErrorCode {
  UNAUTHORIZED(401),
  MISSING_PERMISSIONS(403),
  DELETE_SELF(403),
  MODEL_NOT_FOUND(404),
  SUBMISSION_EXISTS(409),
  NAME_TAKEN(409),
  PRECONDITION_FAILED(412),
  INVALID_USERNAME(422),
  INVALID_NAME(422),
  INVALID_PASSWORD(422),
  INVALID_DISPLAY_NAME(422),
  INVALID_POSITION(422),
  INVALID_REQUIREMENT(422),
  INVALID_PROGRESS(422),
  INVALID_VIDEO(422),
  INVALID_PAGINATION_LIMIT(422),
  BANNED_FROM_SUBMISSIONS(403),
  PLAYER_BANNED(403),
  SUBMIT_LEGACY(403),
  NON_100_EXTENDED(403),
  INVALID_STATE(500),
  DATABASE_ERROR(500),
  CONNECTION_UNAVAILABLE(503),
  QUEUE_FULL(503);

  private final int status;

  ApiErrorCode(int status) {
    this.status = status;
  }

  public int status() {
    return status;
  }
}
