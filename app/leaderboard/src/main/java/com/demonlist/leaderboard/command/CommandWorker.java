/*
 * どこで: コマンドキュー
 * 何を: キューからコマンドを 1 件ずつ取り出し、実行して結果を呼び出し側へ返す
 * なぜ: DB アクセスを固定数のスレッドに閉じ込め、接続プールの枯渇を防ぐため
 */
package com.demonlist.leaderboard.command;

import com.demonlist.common.CommandIds;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.DatabaseException;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.store.StoreSessionFactory;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

class CommandWorker implements Runnable {

  private static final Logger logger = LoggerFactory.getLogger(CommandWorker.class);

  // 停止要求に気付くまでの最大待ち時間
  private static final long POLL_MILLIS = 200;

  private final BlockingQueue<PendingCommand<?>> queue;
  private final StoreSessionFactory sessionFactory;
  private final CommandMetrics metrics;
  private final BooleanSupplier accepting;

  CommandWorker(
      BlockingQueue<PendingCommand<?>> queue,
      StoreSessionFactory sessionFactory,
      CommandMetrics metrics,
      BooleanSupplier accepting) {
    this.queue = queue;
    this.sessionFactory = sessionFactory;
    this.metrics = metrics;
    this.accepting = accepting;
  }

  @Override
  public void run() {
    while (true) {
      final PendingCommand<?> pending;
      try {
        pending = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      if (pending == null) {
        // 受付停止後にキューが空になったら終了する
        if (!accepting.getAsBoolean()) {
          return;
        }
        continue;
      }
      process(pending);
    }
  }

  <R> void process(PendingCommand<R> pending) {
    final String name = pending.command().name();
    MDC.put("command_id", CommandIds.next());
    MDC.put("command", name);
    final long startedAt = System.nanoTime();
    String outcome = CommandMetrics.OUTCOME_OK;
    try {
      final R result;
      try (CommandScope scope = new CommandScope(sessionFactory)) {
        result = pending.execute(scope);
      }
      pending.complete(result);
    } catch (LeaderboardException ex) {
      outcome = ex.code().name();
      if (ex.code() == ApiErrorCode.CONNECTION_UNAVAILABLE) {
        logger.warn("command rejected, no database connection available");
      } else {
        logger.debug("command failed code={} message={}", ex.code(), ex.getMessage());
      }
      pending.fail(ex);
    } catch (DataAccessException | TransactionException ex) {
      outcome = ApiErrorCode.DATABASE_ERROR.name();
      logger.error("database error while executing command", ex);
      pending.fail(new DatabaseException(ex));
    } catch (RuntimeException ex) {
      outcome = "unexpected";
      logger.error("unexpected error while executing command", ex);
      pending.fail(ex);
    } catch (Error ex) {
      // 呼び出し側を待たせたままにしない。JVM 自体の異常以外はワーカーを止めない
      outcome = "unexpected";
      logger.error("error while executing command", ex);
      pending.fail(ex);
      if (ex instanceof VirtualMachineError) {
        throw ex;
      }
    } finally {
      metrics.recordOutcome(name, outcome);
      metrics.recordDuration(name, Duration.ofNanos(System.nanoTime() - startedAt));
      MDC.remove("command_id");
      MDC.remove("command");
    }
  }

  // 停止時に取り残されたコマンドを失敗させる
  static void reject(PendingCommand<?> pending, String reason) {
    pending.fail(new LeaderboardException(ApiErrorCode.QUEUE_FULL, reason));
  }
}
