package com.demonlist.leaderboard.pagination;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;

// 読み取り専用。トランザクションは張らない
public record PaginateCommand<R>(RequestData data, KeysetPagination<R> pagination)
    implements Command<Page<R>> {

  @Override
  public Page<R> execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    ctx.checkPermissions(pagination.requiredPermissions());
    return pagination.restrictTo(ctx).fetch(ctx.session().jdbcTemplate());
  }

  @Override
  public String name() {
    return "Paginate" + pagination.model();
  }
}
