/*
 * どこで: Leaderboard アプリの設定バインド
 * 何を: コマンドキューのワーカー数/キュー容量/停止猶予を保持する
 * なぜ: DB 接続プールの大きさに合わせてワーカー数を環境ごとに調整するため
 */
package com.demonlist.leaderboard.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leaderboard.commands")
@Validated
public record CommandQueueProperties(
    @NotNull @Positive Integer workers,
    @NotNull @Positive Integer queueCapacity,
    @NotNull Duration shutdownTimeout) {

  @AssertTrue(message = "leaderboard.commands.shutdown-timeout must not be negative")
  public boolean isShutdownTimeoutValid() {
    // 0 は「待たずに即中断」を意味するので許容する
    return shutdownTimeout == null || !shutdownTimeout.isNegative();
  }
}
