/*
 * どこで: Leaderboard のドメインモデル
 * 何を: 未永続化の記録提出 (進捗の申告) を表す
 * なぜ: 提出内容はそのまま保存せず、照合の結果としてレコードを作るため
 */
package com.demonlist.leaderboard.model;

public record Submission(
        int progress,
        String player,
        String demon,
        String video,
        boolean verifyOnly) {
}
