/*
 * どこで: リクエストコンテキスト
 * 何を: ワーカーの接続に結び付いた呼び出し元情報と、権限/前提条件の検査を提供する
 * なぜ: 書き込み前の認可と楽観的排他制御をすべてのコマンドで同じ規則にするため
 */
package com.demonlist.leaderboard.context;

import com.demonlist.common.ContentAddressable;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.MissingPermissionsException;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.store.StoreSession;
import java.util.Optional;

public sealed interface RequestContext permits RequestContext.Internal, RequestContext.External {

  StoreSession session();

  Optional<UserRecord> user();

  void checkPermissions(PermissionSet required);

  void checkPrecondition(ContentAddressable target);

  boolean isListHelper();

  boolean isListModerator();

  record Internal(StoreSession session) implements RequestContext {

    @Override
    public Optional<UserRecord> user() {
      return Optional.empty();
    }

    @Override
    public void checkPermissions(PermissionSet required) {}

    @Override
    public void checkPrecondition(ContentAddressable target) {}

    @Override
    public boolean isListHelper() {
      return true;
    }

    @Override
    public boolean isListModerator() {
      return true;
    }
  }

  record External(
      String ip, Optional<UserRecord> user, Optional<Precondition> precondition, StoreSession session)
      implements RequestContext {

    @Override
    public void checkPermissions(PermissionSet required) {
      if (required.isEmpty()) {
        return;
      }
      final UserRecord actor = user.orElseThrow(LeaderboardException::unauthorized);
      if (!actor.hasAny(required)) {
        throw new MissingPermissionsException(required);
      }
    }

    @Override
    public void checkPrecondition(ContentAddressable target) {
      // 前提条件を検査する経路で If-Match が無いのは呼び出し側の組み立てミス
      final Precondition declared =
          precondition.orElseThrow(
              () -> LeaderboardException.invalidState(
                  "precondition checked on a request that declared none"));
      if (!declared.met(target.contentHash())) {
        throw new LeaderboardException(
            ApiErrorCode.PRECONDITION_FAILED, "entity was modified since it was last read");
      }
    }

    @Override
    public boolean isListHelper() {
      return has(Permission.LIST_HELPER);
    }

    @Override
    public boolean isListModerator() {
      return has(Permission.LIST_MODERATOR);
    }

    private boolean has(Permission permission) {
      return user.map(actor -> actor.hasAny(PermissionSet.of(permission))).orElse(false);
    }
  }
}
