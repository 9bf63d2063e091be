/*
 * どこで: パッチプロトコル (ユーザー)
 * 何を: 他ユーザーの表示名/YouTube チャンネル/権限を部分更新する
 * なぜ: リスト管理者はリスト系権限だけを付け外しできる、という権限集合では表せない制約があるため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.MissingPermissionsException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.UserRules;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UserPatchHandler implements PatchHandler<Integer, UserRecord, UserPatch> {

  private static final Logger logger = LoggerFactory.getLogger(UserPatchHandler.class);

  private static final PermissionSet PROFILE =
      PermissionSet.of(Permission.MODERATOR, Permission.ADMINISTRATOR);
  private static final PermissionSet PERMISSIONS =
      PermissionSet.of(Permission.ADMINISTRATOR, Permission.LIST_ADMINISTRATOR);

  @Override
  public String model() {
    return "User";
  }

  @Override
  public PermissionSet requiredPermissions(UserPatch patch) {
    PermissionSet required = PermissionSet.empty();
    if (patch.displayName().isPresent() || patch.youtubeChannel().isPresent()) {
      required = required.union(PROFILE);
    }
    if (patch.permissions().isPresent()) {
      required = required.union(PERMISSIONS);
    }
    return required;
  }

  @Override
  public UserRecord load(RequestContext ctx, Integer id) {
    return ctx.session()
        .users()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("User", id));
  }

  @Override
  public void authorize(RequestContext ctx, UserRecord target, UserPatch patch) {
    final UserRecord actor = ctx.user().orElse(null);
    if (actor == null) {
      // Internal コンテキスト。外部コンテキストで未認証なら checkPermissions で既に弾かれている
      return;
    }
    // 和集合で認可を通っていても、フィールドごとの要件は個別に満たす必要がある
    if ((patch.displayName().isPresent() || patch.youtubeChannel().isPresent())
        && !actor.hasAny(PROFILE)) {
      throw new MissingPermissionsException(PROFILE);
    }
    if (patch.permissions().isPresent() && !actor.hasAny(PermissionSet.of(Permission.ADMINISTRATOR))) {
      if (!actor.hasAny(PermissionSet.of(Permission.LIST_ADMINISTRATOR))) {
        throw new MissingPermissionsException(PERMISSIONS);
      }
      for (Permission changed : changedPermissions(target.permissions(), patch.permissions().value())) {
        if (!changed.isListPermission()) {
          throw new MissingPermissionsException(PermissionSet.of(Permission.ADMINISTRATOR));
        }
      }
    }
  }

  @Override
  public UserRecord apply(
      CommandScope scope, RequestContext ctx, UserRecord target, UserPatch patch) {
    UserRecord patched = target;
    if (patch.displayName().isPresent()) {
      patched = patched.withDisplayName(UserRules.validateDisplayName(patch.displayName().value()));
    }
    if (patch.youtubeChannel().isPresent()) {
      patched = patched.withYoutubeChannel(UserRules.normalizeChannel(patch.youtubeChannel().value()));
    }
    if (patch.permissions().isPresent()) {
      patched = patched.withPermissions(patch.permissions().value());
    }
    return patched;
  }

  @Override
  public UserRecord persist(
      RequestContext ctx, UserRecord original, UserRecord patched, UserPatch patch) {
    ctx.session().users().update(patched);
    if (!original.permissions().equals(patched.permissions())) {
      logger.info(
          "changed permissions of user id={} from={} to={}",
          patched.id(),
          original.permissions(),
          patched.permissions());
    }
    return patched;
  }

  // 付与/剥奪のどちらでも変化したものを返す
  private static Set<Permission> changedPermissions(PermissionSet before, PermissionSet after) {
    final Set<Permission> changed = EnumSet.noneOf(Permission.class);
    for (Permission permission : Permission.values()) {
      if (before.contains(permission) != after.contains(permission)) {
        changed.add(permission);
      }
    }
    return changed;
  }
}
