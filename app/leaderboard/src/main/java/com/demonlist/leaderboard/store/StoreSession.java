/*
 * どこで: Leaderboard のストレージ境界
 * 何を: 1 コマンドの実行中だけ借りる 1 本の接続と、それに紐づくリポジトリを表す
 * なぜ: サブコマンドも含めて同じ接続・同じトランザクション境界で操作させるため
 */
package com.demonlist.leaderboard.store;

import com.demonlist.leaderboard.repository.DemonRepository;
import com.demonlist.leaderboard.repository.PlayerRepository;
import com.demonlist.leaderboard.repository.ProgressRecordRepository;
import com.demonlist.leaderboard.repository.SubmitterRepository;
import com.demonlist.leaderboard.repository.UserRepository;
import java.util.function.Supplier;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public interface StoreSession extends AutoCloseable {

  PlayerRepository players();

  DemonRepository demons();

  SubmitterRepository submitters();

  ProgressRecordRepository records();

  UserRepository users();

  // ページングのように動的 SQL を組み立てる処理向け
  NamedParameterJdbcTemplate jdbcTemplate();

  // 例外が出た場合はロールバックされ、そのまま呼び出し側へ伝播する
  <T> T inTransaction(Supplier<T> work);

  @Override
  void close();
}
