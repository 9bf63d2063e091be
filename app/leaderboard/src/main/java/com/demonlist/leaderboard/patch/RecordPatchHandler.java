/*
 * どこで: パッチプロトコル (レコード)
 * 何を: レコードの進捗/動画/状態/プレイヤー/デーモンを部分更新する
 * なぜ: デーモンを付け替えた場合でも、新しいデーモンの要求進捗で進捗を検証し直す必要があるため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.InvalidProgressException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.operation.DemonByNameCommand;
import com.demonlist.leaderboard.operation.PlayerByNameCommand;
import com.demonlist.leaderboard.video.VideoValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecordPatchHandler implements PatchHandler<Integer, ProgressRecord, RecordPatch> {

  private static final PermissionSet REQUIRED =
      PermissionSet.of(
          Permission.LIST_HELPER, Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR);

  private final VideoValidator videoValidator;

  @Override
  public String model() {
    return "Record";
  }

  @Override
  public PermissionSet requiredPermissions(RecordPatch patch) {
    return REQUIRED;
  }

  @Override
  public ProgressRecord load(RequestContext ctx, Integer id) {
    return ctx.session()
        .records()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("Record", id));
  }

  @Override
  public ProgressRecord apply(
      CommandScope scope, RequestContext ctx, ProgressRecord target, RecordPatch patch) {
    ProgressRecord patched = target;
    if (patch.demon().isPresent() || patch.progress().isPresent()) {
      final String demonName = patch.demon().orElse(target.demon().name());
      final DemonRecord demon = scope.dispatch(new DemonByNameCommand(demonName));
      final int progress = patch.progress().orElse(target.progress());
      if (progress > 100 || progress < demon.requirement()) {
        throw new InvalidProgressException(demon.requirement());
      }
      patched = patched.withDemon(demon.embedded()).withProgress(progress);
    }
    if (patch.video().isPresent()) {
      patched = patched.withVideo(patch.video().map(videoValidator::validate).value());
    }
    if (patch.status().isPresent()) {
      patched = patched.withStatus(patch.status().value());
    }
    if (patch.player().isPresent()) {
      patched = patched.withPlayer(scope.dispatch(new PlayerByNameCommand(patch.player().value())));
    }
    return patched;
  }

  @Override
  public ProgressRecord persist(
      RequestContext ctx, ProgressRecord original, ProgressRecord patched, RecordPatch patch) {
    ctx.session().records().update(patched);
    return patched;
  }
}
