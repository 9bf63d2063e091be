package com.demonlist.leaderboard.api;

import com.demonlist.leaderboard.model.RecordStatus;

public class SubmissionExistsException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  private final RecordStatus status;
  private final int existingId;

  public SubmissionExistsException(RecordStatus status, int existingId) {
    super(
        ApiErrorCode.SUBMISSION_EXISTS,
        "a matching record (id " + existingId + ", status " + status + ") already exists");
    this.status = status;
    this.existingId = existingId;
  }

  public RecordStatus status() {
    return status;
  }

  public int existingId() {
    return existingId;
  }
}
