package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record DeleteUserByIdCommand(RequestData data, int id) implements Command<Void> {

  private static final Logger logger = LoggerFactory.getLogger(DeleteUserByIdCommand.class);

  @Override
  public Void execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    ctx.checkPermissions(PermissionSet.of(Permission.ADMINISTRATOR));
    if (ctx.user().map(actor -> actor.id() == id).orElse(false)) {
      throw new LeaderboardException(ApiErrorCode.DELETE_SELF, "you cannot delete your own account");
    }
    if (!ctx.session().users().deleteById(id)) {
      throw new ModelNotFoundException("User", id);
    }
    logger.info("deleted user id={}", id);
    return null;
  }
}
