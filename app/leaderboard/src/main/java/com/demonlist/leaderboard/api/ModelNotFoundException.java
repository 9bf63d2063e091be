package com.demonlist.leaderboard.api;

public class ModelNotFoundException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  private final String model;
  private final String identifiedBy;

  public ModelNotFoundException(String model, Object identifiedBy) {
    super(ApiErrorCode.MODEL_NOT_FOUND, model + " identified by '" + identifiedBy + "' not found");
    this.model = model;
    this.identifiedBy = String.valueOf(identifiedBy);
  }

  public String model() {
    return model;
  }

  public String identifiedBy() {
    return identifiedBy;
  }
}
