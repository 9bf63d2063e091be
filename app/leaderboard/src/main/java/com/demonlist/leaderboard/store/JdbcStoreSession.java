/*
 * どこで: Leaderboard のストレージ境界
 * 何を: プールから借りた Connection を 1 本に固定した JdbcTemplate/TransactionTemplate を提供する
 * なぜ: コマンド内の全クエリとトランザクションが同じ物理接続上で走る必要があるため
 */
package com.demonlist.leaderboard.store;

import com.demonlist.leaderboard.repository.DemonRepository;
import com.demonlist.leaderboard.repository.PlayerRepository;
import com.demonlist.leaderboard.repository.ProgressRecordRepository;
import com.demonlist.leaderboard.repository.SubmitterRepository;
import com.demonlist.leaderboard.repository.UserRepository;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

public class JdbcStoreSession implements StoreSession {

  private static final Logger logger = LoggerFactory.getLogger(JdbcStoreSession.class);

  private final Connection connection;
  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final PlayerRepository players;
  private final DemonRepository demons;
  private final SubmitterRepository submitters;
  private final ProgressRecordRepository records;
  private final UserRepository users;

  public JdbcStoreSession(Connection connection) {
    this.connection = connection;
    // suppressClose=true: JdbcTemplate が close しても物理接続はセッション終了まで保持する
    final SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
    this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
    this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    this.players = new PlayerRepository(jdbcTemplate);
    this.demons = new DemonRepository(jdbcTemplate);
    this.submitters = new SubmitterRepository(jdbcTemplate);
    this.records = new ProgressRecordRepository(jdbcTemplate);
    this.users = new UserRepository(jdbcTemplate);
  }

  @Override
  public PlayerRepository players() {
    return players;
  }

  @Override
  public DemonRepository demons() {
    return demons;
  }

  @Override
  public SubmitterRepository submitters() {
    return submitters;
  }

  @Override
  public ProgressRecordRepository records() {
    return records;
  }

  @Override
  public UserRepository users() {
    return users;
  }

  @Override
  public NamedParameterJdbcTemplate jdbcTemplate() {
    return jdbcTemplate;
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    return transactionTemplate.execute(status -> work.get());
  }

  @Override
  public void close() {
    try {
      // プールへ返却する。Hikari 側で autocommit 等の状態はリセットされる
      connection.close();
    } catch (SQLException ex) {
      logger.warn("failed to return connection to pool", ex);
    }
  }
}
