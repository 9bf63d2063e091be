/*
 * どこで: リクエストコンテキスト
 * 何を: コマンドに同梱される「誰から・どの前提で」の情報 (接続はまだ持たない)
 * なぜ: キュー投入時点では接続が無く、ワーカーが借りた接続と後から結び付ける必要があるため
 */
package com.demonlist.leaderboard.context;

import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.store.StoreSession;
import java.util.Objects;
import java.util.Optional;

public sealed interface RequestData permits RequestData.Internal, RequestData.External {

  static Internal internal() {
    return Internal.INSTANCE;
  }

  static External external(String ip) {
    return new External(ip, Optional.empty(), Optional.empty());
  }

  RequestContext bind(StoreSession session);

  // システム自身が発行する操作。権限/前提条件の検査をすべて素通りする
  record Internal() implements RequestData {

    private static final Internal INSTANCE = new Internal();

    @Override
    public RequestContext bind(StoreSession session) {
      return new RequestContext.Internal(session);
    }
  }

  record External(String ip, Optional<UserRecord> user, Optional<Precondition> precondition)
      implements RequestData {

    public External {
      Objects.requireNonNull(ip, "ip");
      user = user == null ? Optional.empty() : user;
      precondition = precondition == null ? Optional.empty() : precondition;
    }

    public External withUser(UserRecord newUser) {
      return new External(ip, Optional.ofNullable(newUser), precondition);
    }

    public External withPrecondition(Precondition newPrecondition) {
      return new External(ip, user, Optional.ofNullable(newPrecondition));
    }

    @Override
    public RequestContext bind(StoreSession session) {
      return new RequestContext.External(ip, user, precondition, session);
    }
  }
}
