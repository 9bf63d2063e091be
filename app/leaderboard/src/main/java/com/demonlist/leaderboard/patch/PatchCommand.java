/*
 * どこで: パッチプロトコル
 * 何を: 任意のエンティティへの部分更新を、認可→前提条件→検証→永続化の順で実行する
 * なぜ: 検証に失敗したパッチや権限の無いパッチで書き込みが一切起きないことを保証するため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.common.ContentAddressable;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record PatchCommand<K, E extends ContentAddressable, P>(
    RequestData data, K key, P patch, PatchHandler<K, E, P> handler) implements Command<E> {

  private static final Logger logger = LoggerFactory.getLogger(PatchCommand.class);

  @Override
  public E execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    ctx.checkPermissions(handler.requiredPermissions(patch));

    final E target = handler.load(ctx, key);
    handler.authorize(ctx, target, patch);
    // 前提条件はパッチ適用前の状態に対して検査する
    ctx.checkPrecondition(target);

    final E patched = handler.apply(scope, ctx, target, patch);
    final E persisted =
        ctx.session().inTransaction(() -> handler.persist(ctx, target, patched, patch));
    logger.info("patched {} key={}", handler.model(), key);
    return persisted;
  }

  @Override
  public String name() {
    return "Patch" + handler.model();
  }
}
