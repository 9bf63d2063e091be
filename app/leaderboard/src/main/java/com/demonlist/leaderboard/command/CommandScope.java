/*
 * どこで: コマンドキュー
 * 何を: 1 コマンド実行分の接続とサブコマンド実行を提供する
 * なぜ: 接続は最初に使われた時点で借り、コマンド終了時に必ず返す必要があるため
 */
package com.demonlist.leaderboard.command;

import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.store.StoreSession;
import com.demonlist.leaderboard.store.StoreSessionFactory;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

public class CommandScope implements AutoCloseable {

  private final StoreSessionFactory sessionFactory;
  private final List<String> mdcKeys = new ArrayList<>();
  private StoreSession session;

  public CommandScope(StoreSessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  public StoreSession session() {
    if (session == null) {
      session = sessionFactory.open();
    }
    return session;
  }

  // 同じワーカー・同じ接続で同期実行する。キューには戻さない
  public <R> R dispatch(Command<R> command) {
    return command.execute(this);
  }

  public RequestContext bind(RequestData data) {
    if (data instanceof RequestData.External external) {
      put("client_ip", external.ip());
      external.user().ifPresent(user -> put("user_id", String.valueOf(user.id())));
    }
    return data.bind(session());
  }

  @Override
  public void close() {
    for (String key : mdcKeys) {
      MDC.remove(key);
    }
    mdcKeys.clear();
    if (session != null) {
      session.close();
      session = null;
    }
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    mdcKeys.add(key);
  }
}
