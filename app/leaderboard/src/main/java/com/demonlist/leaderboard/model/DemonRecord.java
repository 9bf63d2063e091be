/*
 * どこで: Leaderboard のドメインモデル
 * 何を: demons テーブル相当のドメインレコード (verifier/publisher は展開済み)
 * なぜ: リスト順位・要求進捗など提出判定に必要な情報をまとめて扱うため
 */
package com.demonlist.leaderboard.model;

import com.demonlist.common.ContentAddressable;
import java.util.LinkedHashMap;
import java.util.Map;

public record DemonRecord(
        String name,
        int position,
        int requirement,
        String video,
        PlayerRecord verifier,
        PlayerRecord publisher) implements ContentAddressable {

    public DemonRecord withName(String newName) {
        return new DemonRecord(newName, position, requirement, video, verifier, publisher);
    }

    public DemonRecord withPosition(int newPosition) {
        return new DemonRecord(name, newPosition, requirement, video, verifier, publisher);
    }

    public DemonRecord withRequirement(int newRequirement) {
        return new DemonRecord(name, position, newRequirement, video, verifier, publisher);
    }

    public DemonRecord withVideo(String newVideo) {
        return new DemonRecord(name, position, requirement, newVideo, verifier, publisher);
    }

    public DemonRecord withVerifier(PlayerRecord newVerifier) {
        return new DemonRecord(name, position, requirement, video, newVerifier, publisher);
    }

    public DemonRecord withPublisher(PlayerRecord newPublisher) {
        return new DemonRecord(name, position, requirement, video, verifier, newPublisher);
    }

    public EmbeddedDemon embedded() {
        return new EmbeddedDemon(name, position);
    }

    @Override
    public Map<String, Object> contentFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("position", position);
        fields.put("requirement", requirement);
        fields.put("video", video);
        fields.put("verifier", verifier.id());
        fields.put("publisher", publisher.id());
        return fields;
    }
}
