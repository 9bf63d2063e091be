/*
 * どこで: コマンドキュー
 * 何を: コマンド件数(結果別)/処理時間/キュー滞留数のメトリクスを記録する
 * なぜ: ワーカー数と接続プールの過不足を Prometheus から観測できるようにするため
 */
package com.demonlist.leaderboard.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CommandMetrics {

  static final String OUTCOME_OK = "ok";

  private static final String METRIC_COMMAND_TOTAL = "leaderboard.command.total";
  private static final String METRIC_COMMAND_DURATION = "leaderboard.command.duration";
  private static final String METRIC_QUEUE_DEPTH = "leaderboard.command.queue.depth";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

  public CommandMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void bindQueue(Collection<?> queue) {
    Gauge.builder(METRIC_QUEUE_DEPTH, queue, Collection::size)
        .description("Commands waiting for an idle worker")
        .register(meterRegistry);
  }

  // outcome は "ok" かエラーコード名
  public void recordOutcome(String command, String outcome) {
    counters
        .computeIfAbsent(
            command + '|' + outcome,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Executed commands by outcome")
                    .tags(Tags.of("command", command, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDuration(String command, Duration duration) {
    timers
        .computeIfAbsent(
            command,
            ignored ->
                Timer.builder(METRIC_COMMAND_DURATION)
                    .description("Time a worker spent executing a command")
                    .tags(Tags.of("command", command))
                    .register(meterRegistry))
        .record(duration);
  }
}
