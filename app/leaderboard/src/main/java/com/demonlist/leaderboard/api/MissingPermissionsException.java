package com.demonlist.leaderboard.api;

import com.demonlist.leaderboard.model.PermissionSet;

public class MissingPermissionsException extends LeaderboardException {

  private static final long serialVersionUID = 1L;

  private final transient PermissionSet required;

  public MissingPermissionsException(PermissionSet required) {
    super(ApiErrorCode.MISSING_PERMISSIONS, "missing permissions, one of " + required + " required");
    this.required = required;
  }

  public PermissionSet required() {
    return required;
  }
}
