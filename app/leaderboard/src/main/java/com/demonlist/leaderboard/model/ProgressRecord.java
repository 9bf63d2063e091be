/*
 * どこで: Leaderboard のドメインモデル
 * 何を: records テーブル相当のドメインレコード (プレイヤーとデーモンは展開済み)
 * なぜ: 提出の重複判定とパッチで同じ形を使うため
 */
package com.demonlist.leaderboard.model;

import com.demonlist.common.ContentAddressable;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProgressRecord(
        int id,
        int progress,
        String video,
        RecordStatus status,
        PlayerRecord player,
        int submitterId,
        EmbeddedDemon demon) implements ContentAddressable {

    public ProgressRecord withProgress(int newProgress) {
        return new ProgressRecord(id, newProgress, video, status, player, submitterId, demon);
    }

    public ProgressRecord withVideo(String newVideo) {
        return new ProgressRecord(id, progress, newVideo, status, player, submitterId, demon);
    }

    public ProgressRecord withStatus(RecordStatus newStatus) {
        return new ProgressRecord(id, progress, video, newStatus, player, submitterId, demon);
    }

    public ProgressRecord withPlayer(PlayerRecord newPlayer) {
        return new ProgressRecord(id, progress, video, status, newPlayer, submitterId, demon);
    }

    public ProgressRecord withDemon(EmbeddedDemon newDemon) {
        return new ProgressRecord(id, progress, video, status, player, submitterId, newDemon);
    }

    @Override
    public Map<String, Object> contentFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("progress", progress);
        fields.put("video", video);
        fields.put("status", status.name());
        fields.put("player", player.id());
        fields.put("submitter", submitterId);
        fields.put("demon", demon.name());
        return fields;
    }
}
