/*
 * どこで: Leaderboard のドメインモデル
 * 何を: submitters テーブル相当のドメインレコード
 * なぜ: 提出元 IP ごとの BAN 状態を判定するため
 */
package com.demonlist.leaderboard.model;

import com.demonlist.common.ContentAddressable;
import java.util.LinkedHashMap;
import java.util.Map;

public record SubmitterRecord(
        int id,
        String ip,
        boolean banned) implements ContentAddressable {

    public SubmitterRecord withBanned(boolean newBanned) {
        return new SubmitterRecord(id, ip, newBanned);
    }

    @Override
    public Map<String, Object> contentFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("banned", banned);
        return fields;
    }
}
