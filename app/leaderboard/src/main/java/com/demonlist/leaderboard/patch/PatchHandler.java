/*
 * どこで: パッチプロトコル
 * 何を: エンティティ種別ごとの「必要権限・読み込み・検証/適用・永続化」を定義する
 * なぜ: 認可→前提条件→検証→トランザクション内書き込み、の順序を PatchCommand 側で一本化するため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.common.ContentAddressable;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.PermissionSet;

public interface PatchHandler<K, E extends ContentAddressable, P> {

  String model();

  // パッチに含まれるフィールドが要求する権限の和集合
  PermissionSet requiredPermissions(P patch);

  E load(RequestContext ctx, K key);

  // 権限集合だけでは表せない、操作者と対象に依存する認可。既定では何もしない
  default void authorize(RequestContext ctx, E target, P patch) {}

  // 検証とメモリ上での適用のみ。ここでは書き込まない
  E apply(CommandScope scope, RequestContext ctx, E target, P patch);

  // トランザクション内で呼ばれる
  E persist(RequestContext ctx, E original, E patched, P patch);
}
