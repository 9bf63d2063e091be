package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record DeleteRecordByIdCommand(RequestData data, int id) implements Command<Void> {

  private static final Logger logger = LoggerFactory.getLogger(DeleteRecordByIdCommand.class);

  @Override
  public Void execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    ctx.checkPermissions(PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR));
    if (!ctx.session().records().deleteById(id)) {
      throw new ModelNotFoundException("Record", id);
    }
    logger.info("deleted record id={}", id);
    return null;
  }
}
