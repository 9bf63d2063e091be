package com.demonlist.common;

import java.util.UUID;

// ログの command_id 用。衝突しにくさより読みやすさを優先して 16 桁に詰める
public final class CommandIds {

  private static final int LENGTH = 16;

  private CommandIds() {}

  public static String next() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
  }
}
