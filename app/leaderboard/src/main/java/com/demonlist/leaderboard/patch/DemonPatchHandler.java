/*
 * どこで: パッチプロトコル (デーモン)
 * 何を: デーモンの名前/順位/要求進捗/動画/verifier/publisher を部分更新する
 * なぜ: 順位変更では前後のデーモンを詰め直す必要があり、行更新と同じトランザクションで行うため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.operation.DemonRules;
import com.demonlist.leaderboard.operation.PlayerByNameCommand;
import com.demonlist.leaderboard.repository.DemonRepository;
import com.demonlist.leaderboard.video.VideoValidator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DemonPatchHandler implements PatchHandler<String, DemonRecord, DemonPatch> {

  private static final Logger logger = LoggerFactory.getLogger(DemonPatchHandler.class);

  private static final PermissionSet REQUIRED =
      PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR);

  private final VideoValidator videoValidator;

  @Override
  public String model() {
    return "Demon";
  }

  @Override
  public PermissionSet requiredPermissions(DemonPatch patch) {
    return REQUIRED;
  }

  @Override
  public DemonRecord load(RequestContext ctx, String name) {
    return ctx.session()
        .demons()
        .findByName(name)
        .orElseThrow(() -> new ModelNotFoundException("Demon", name));
  }

  @Override
  public DemonRecord apply(
      CommandScope scope, RequestContext ctx, DemonRecord target, DemonPatch patch) {
    final DemonRepository demons = ctx.session().demons();
    DemonRecord patched = target;
    if (patch.name().isPresent()) {
      patched = patched.withName(DemonRules.validateName(patch.name().value(), target.name(), demons));
    }
    if (patch.position().isPresent()) {
      final int position = patch.position().value();
      DemonRules.validatePosition(position, demons.count());
      patched = patched.withPosition(position);
    }
    if (patch.requirement().isPresent()) {
      final int requirement = patch.requirement().value();
      DemonRules.validateRequirement(requirement);
      patched = patched.withRequirement(requirement);
    }
    if (patch.video().isPresent()) {
      patched = patched.withVideo(patch.video().map(videoValidator::validate).value());
    }
    if (patch.verifier().isPresent()) {
      patched = patched.withVerifier(scope.dispatch(new PlayerByNameCommand(patch.verifier().value())));
    }
    if (patch.publisher().isPresent()) {
      patched =
          patched.withPublisher(scope.dispatch(new PlayerByNameCommand(patch.publisher().value())));
    }
    return patched;
  }

  @Override
  public DemonRecord persist(
      RequestContext ctx, DemonRecord original, DemonRecord patched, DemonPatch patch) {
    final DemonRepository demons = ctx.session().demons();
    // 順位移動は旧名で行を特定するため、改名より先に行う
    if (patched.position() != original.position()) {
      demons.move(original.name(), original.position(), patched.position());
      logger.info(
          "moved demon name={} from={} to={}",
          original.name(),
          original.position(),
          patched.position());
    }
    demons.update(original.name(), patched);
    return patched;
  }
}
