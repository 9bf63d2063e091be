/*
 * どこで: Leaderboard のドメインモデル
 * 何を: players テーブル相当のドメインレコード
 * なぜ: レコード/デーモンから参照されるプレイヤー情報を一箇所で表すため
 */
package com.demonlist.leaderboard.model;

import com.demonlist.common.ContentAddressable;
import java.util.LinkedHashMap;
import java.util.Map;

public record PlayerRecord(
        int id,
        String name,
        boolean banned) implements ContentAddressable {

    public PlayerRecord withName(String newName) {
        return new PlayerRecord(id, newName, banned);
    }

    public PlayerRecord withBanned(boolean newBanned) {
        return new PlayerRecord(id, name, newBanned);
    }

    @Override
    public Map<String, Object> contentFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("name", name);
        fields.put("banned", banned);
        return fields;
    }
}
