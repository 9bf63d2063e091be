/*
 * どこで: Leaderboard アプリの設定バインド
 * 何を: メインリスト/拡張リストの長さを保持する
 * なぜ: 提出可否(レガシー/拡張リスト判定)の境界を運用で変えられるようにするため
 */
package com.demonlist.leaderboard.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leaderboard.list")
@Validated
public record ListProperties(@NotNull @Positive Integer size, @NotNull @Positive Integer extendedSize) {

  @AssertTrue(message = "leaderboard.list.extended-size must not be smaller than leaderboard.list.size")
  public boolean isExtendedSizeConsistent() {
    return size == null || extendedSize == null || extendedSize >= size;
  }
}
