/*
 * どこで: コマンドキュー
 * 何を: コマンドを有限キューに積み、固定数のワーカースレッドで実行する
 * なぜ: 呼び出し側スレッドから DB アクセスを切り離し、同時実行数を接続プールに合わせるため
 */
package com.demonlist.leaderboard.command;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.config.CommandQueueProperties;
import com.demonlist.leaderboard.store.StoreSessionFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StoreSessionFactory/CommandMetrics は Spring 管理の共有コンポーネントのため")
public class CommandQueue implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(CommandQueue.class);

  private final BlockingQueue<PendingCommand<?>> queue;
  private final StoreSessionFactory sessionFactory;
  private final CommandQueueProperties properties;
  private final CommandMetrics metrics;
  private final List<Thread> workers = new ArrayList<>();
  private volatile boolean running;

  public CommandQueue(
      StoreSessionFactory sessionFactory,
      CommandQueueProperties properties,
      CommandMetrics metrics) {
    this.sessionFactory = sessionFactory;
    this.properties = properties;
    this.metrics = metrics;
    this.queue = new LinkedBlockingQueue<>(properties.queueCapacity());
    metrics.bindQueue(queue);
  }

  // 呼び出しスレッドは結果が出るまでブロックする
  public <R> R submit(Command<R> command) {
    try {
      return submitAsync(command).join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }

  public <R> CompletableFuture<R> submitAsync(Command<R> command) {
    if (!running) {
      return CompletableFuture.failedFuture(
          new LeaderboardException(ApiErrorCode.QUEUE_FULL, "command queue is not accepting commands"));
    }
    final PendingCommand<R> pending = new PendingCommand<>(command);
    if (!queue.offer(pending)) {
      logger.warn("command queue full, rejecting command={}", command.name());
      metrics.recordOutcome(command.name(), ApiErrorCode.QUEUE_FULL.name());
      return CompletableFuture.failedFuture(
          new LeaderboardException(ApiErrorCode.QUEUE_FULL, "command queue is full"));
    }
    // offer の間に stop() が走った場合、取り残されたコマンドはここで引き取って失敗させる
    if (!running && queue.remove(pending)) {
      CommandWorker.reject(pending, "command queue is not accepting commands");
    }
    return pending.result();
  }

  public int pending() {
    return queue.size();
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    for (int i = 0; i < properties.workers(); i++) {
      final Thread thread =
          new Thread(
              new CommandWorker(queue, sessionFactory, metrics, () -> running),
              "leaderboard-worker-" + i);
      thread.start();
      workers.add(thread);
    }
    logger.info(
        "command queue started workers={} capacity={}",
        properties.workers(),
        properties.queueCapacity());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    // 新規受付を止め、積まれている分は猶予時間内に処理させる
    running = false;
    final long deadline = System.nanoTime() + properties.shutdownTimeout().toNanos();
    for (Thread worker : workers) {
      final long remainingMillis = Math.max(0, (deadline - System.nanoTime()) / 1_000_000);
      try {
        if (remainingMillis > 0) {
          worker.join(remainingMillis);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    for (Thread worker : workers) {
      if (worker.isAlive()) {
        worker.interrupt();
      }
    }
    workers.clear();
    final List<PendingCommand<?>> leftovers = new ArrayList<>();
    queue.drainTo(leftovers);
    for (PendingCommand<?> pending : leftovers) {
      CommandWorker.reject(pending, "command queue shut down before the command ran");
    }
    if (!leftovers.isEmpty()) {
      logger.warn("command queue stopped with {} unprocessed commands", leftovers.size());
    } else {
      logger.info("command queue stopped");
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
