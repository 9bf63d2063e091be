package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;

// 登録と自己パッチ/ユーザーパッチで共有する検証規則
public final class UserRules {

  static final int MIN_NAME_LENGTH = 3;
  static final int MIN_PASSWORD_LENGTH = 10;

  private UserRules() {}

  // 前後の空白を含む名前は受け付けない (トリムして通すと別名義を作れてしまうため)
  public static void validateUsername(String name) {
    if (name == null || name.length() < MIN_NAME_LENGTH || !name.equals(name.trim())) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_USERNAME,
          "usernames must be at least 3 characters long and have no leading or trailing spaces");
    }
  }

  public static void validatePassword(String password) {
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_PASSWORD, "passwords must be at least 10 characters long");
    }
  }

  // null は「表示名を消す」。それ以外はトリム後 3 文字以上
  public static String validateDisplayName(String displayName) {
    if (displayName == null) {
      return null;
    }
    final String trimmed = displayName.trim();
    if (trimmed.length() < MIN_NAME_LENGTH) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_DISPLAY_NAME,
          "display names must be at least 3 characters long after trimming");
    }
    return trimmed;
  }

  public static String normalizeChannel(String channel) {
    if (channel == null || channel.isBlank()) {
      return null;
    }
    return channel.trim();
  }
}
