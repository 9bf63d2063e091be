/*
 * どこで: Leaderboard のドメインモデル
 * 何を: members テーブル相当のドメインレコード
 * なぜ: 認証・認可・自己パッチで同じユーザー情報を受け渡すため
 */
package com.demonlist.leaderboard.model;

import com.demonlist.common.ContentAddressable;
import java.util.LinkedHashMap;
import java.util.Map;

public record UserRecord(
        int id,
        String name,
        String displayName,
        String youtubeChannel,
        PermissionSet permissions,
        String passwordHash) implements ContentAddressable {

    public UserRecord withDisplayName(String newDisplayName) {
        return new UserRecord(id, name, newDisplayName, youtubeChannel, permissions, passwordHash);
    }

    public UserRecord withYoutubeChannel(String newYoutubeChannel) {
        return new UserRecord(id, name, displayName, newYoutubeChannel, permissions, passwordHash);
    }

    public UserRecord withPermissions(PermissionSet newPermissions) {
        return new UserRecord(id, name, displayName, youtubeChannel, newPermissions, passwordHash);
    }

    public UserRecord withPasswordHash(String newPasswordHash) {
        return new UserRecord(id, name, displayName, youtubeChannel, permissions, newPasswordHash);
    }

    public boolean hasAny(PermissionSet required) {
        return permissions.implied().intersects(required);
    }

    // パスワードハッシュはトークン/ETag に影響させない
    @Override
    public Map<String, Object> contentFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("name", name);
        fields.put("display_name", displayName);
        fields.put("youtube_channel", youtubeChannel);
        fields.put("permissions", permissions.bits());
        return fields;
    }

    @Override
    public String toString() {
        return "UserRecord[id=" + id + ", name=" + name + ", permissions=" + permissions + "]";
    }
}
