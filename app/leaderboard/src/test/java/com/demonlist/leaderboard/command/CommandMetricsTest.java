package com.demonlist.leaderboard.command;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.Test;

class CommandMetricsTest {

  @Test
  void recordsOutcomeDurationAndQueueDepth() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CommandMetrics metrics = new CommandMetrics(registry);
    final Deque<String> queue = new ArrayDeque<>();
    metrics.bindQueue(queue);

    metrics.recordOutcome("PatchDemon", "ok");
    metrics.recordOutcome("PatchDemon", "ok");
    metrics.recordOutcome("PatchDemon", "PRECONDITION_FAILED");
    metrics.recordDuration("PatchDemon", Duration.ofMillis(12));
    queue.add("a");
    queue.add("b");

    assertThat(
            registry
                .get("leaderboard.command.total")
                .tags("command", "PatchDemon", "outcome", "ok")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("leaderboard.command.total")
                .tags("command", "PatchDemon", "outcome", "PRECONDITION_FAILED")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("leaderboard.command.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("leaderboard.command.queue.depth").gauge().value()).isEqualTo(2.0d);
  }
}
