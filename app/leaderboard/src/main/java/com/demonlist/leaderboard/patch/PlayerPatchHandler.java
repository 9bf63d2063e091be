package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.repository.ProgressRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PlayerPatchHandler implements PatchHandler<Integer, PlayerRecord, PlayerPatch> {

  private static final Logger logger = LoggerFactory.getLogger(PlayerPatchHandler.class);

  private static final PermissionSet REQUIRED =
      PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR);

  @Override
  public String model() {
    return "Player";
  }

  @Override
  public PermissionSet requiredPermissions(PlayerPatch patch) {
    return REQUIRED;
  }

  @Override
  public PlayerRecord load(RequestContext ctx, Integer id) {
    return ctx.session()
        .players()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("Player", id));
  }

  @Override
  public PlayerRecord apply(
      CommandScope scope, RequestContext ctx, PlayerRecord target, PlayerPatch patch) {
    PlayerRecord patched = target;
    if (patch.name().isPresent()) {
      final String name = patch.name().value().trim();
      if (name.isEmpty()) {
        throw new LeaderboardException(ApiErrorCode.INVALID_NAME, "player name must not be blank");
      }
      if (ctx.session().players().existsOtherWithName(name, target.id())) {
        throw new LeaderboardException(
            ApiErrorCode.NAME_TAKEN, "a player named '" + name + "' already exists");
      }
      patched = patched.withName(name);
    }
    if (patch.banned().isPresent()) {
      patched = patched.withBanned(patch.banned().value());
    }
    return patched;
  }

  @Override
  public PlayerRecord persist(
      RequestContext ctx, PlayerRecord original, PlayerRecord patched, PlayerPatch patch) {
    ctx.session().players().update(patched);
    if (patched.banned() && !original.banned()) {
      // 審査待ちは消し、それ以外は却下扱いにする
      final ProgressRecordRepository records = ctx.session().records();
      final int deleted = records.deleteSubmittedByPlayer(patched.id());
      final int rejected = records.rejectAllByPlayer(patched.id());
      logger.info(
          "banned player id={} deletedSubmissions={} rejectedRecords={}",
          patched.id(),
          deleted,
          rejected);
    }
    return patched;
  }
}
