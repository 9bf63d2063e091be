/*
 * どこで: Leaderboard のドメインモデル
 * 何を: レコードの審査状態を表す列挙型
 * なぜ: 重複提出の判定で状態ごとに扱いを変えるため
 */
package com.demonlist.leaderboard.model;

public enum RecordStatus {
    SUBMITTED,
    APPROVED,
    REJECTED
}
