package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.repository.DemonRepository;

// デーモンの挿入とパッチで共有する検証規則
public final class DemonRules {

  private DemonRules() {}

  // 前後の空白は落として返す。excludingName は改名時の自分自身
  public static String validateName(String name, String excludingName, DemonRepository demons) {
    final String trimmed = name == null ? "" : name.trim();
    if (trimmed.isEmpty()) {
      throw new LeaderboardException(ApiErrorCode.INVALID_NAME, "demon name must not be blank");
    }
    if (demons.existsOtherWithName(trimmed, excludingName)) {
      throw new LeaderboardException(
          ApiErrorCode.NAME_TAKEN, "a demon named '" + trimmed + "' already exists");
    }
    return trimmed;
  }

  public static void validatePosition(int position, int maxPosition) {
    if (position < 1 || position > maxPosition) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_POSITION, "position must be between 1 and " + maxPosition);
    }
  }

  public static void validateRequirement(int requirement) {
    if (requirement < 0 || requirement > 100) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_REQUIREMENT, "requirement must be between 0 and 100");
    }
  }
}
