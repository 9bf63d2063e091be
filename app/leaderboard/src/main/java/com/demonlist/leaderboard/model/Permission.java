/*
 * どこで: Leaderboard のドメインモデル
 * 何を: ユーザーに付与できる権限フラグを表す列挙型
 * なぜ: members.permissions のビット列と型安全な判定を対応付けるため
 */
package com.demonlist.leaderboard.model;

public enum Permission {
    EXTENDED_ACCESS(0b1),
    LIST_HELPER(0b10),
    LIST_MODERATOR(0b100),
    LIST_ADMINISTRATOR(0b1000),
    LEADERBOARD_MODERATOR(0b1_0000),
    LEADERBOARD_ADMINISTRATOR(0b10_0000),
    MODERATOR(0b10_0000_0000_0000),
    ADMINISTRATOR(0b100_0000_0000_0000);

    private final int bit;

    Permission(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    // 上位権限は下位権限を暗黙に含む (例: LIST_ADMINISTRATOR は LIST_MODERATOR を持つ)
    public Permission implies() {
        return switch (this) {
            case LIST_MODERATOR -> LIST_HELPER;
            case LIST_ADMINISTRATOR -> LIST_MODERATOR;
            case LEADERBOARD_ADMINISTRATOR -> LEADERBOARD_MODERATOR;
            case ADMINISTRATOR -> MODERATOR;
            default -> null;
        };
    }

    public boolean isListPermission() {
        return this == LIST_HELPER || this == LIST_MODERATOR || this == LIST_ADMINISTRATOR;
    }
}
