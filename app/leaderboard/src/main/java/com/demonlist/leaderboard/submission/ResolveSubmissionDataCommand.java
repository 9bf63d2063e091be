package com.demonlist.leaderboard.submission;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.operation.DemonByNameCommand;
import com.demonlist.leaderboard.operation.PlayerByNameCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// 提出に書かれた名前をプレイヤー(無ければ作成)とデーモンに解決する
public record ResolveSubmissionDataCommand(String player, String demon)
    implements Command<ResolvedSubmission> {

  private static final Logger logger = LoggerFactory.getLogger(ResolveSubmissionDataCommand.class);

  @Override
  public ResolvedSubmission execute(CommandScope scope) {
    final PlayerRecord resolvedPlayer = scope.dispatch(new PlayerByNameCommand(player));
    final DemonRecord resolvedDemon = scope.dispatch(new DemonByNameCommand(demon));
    logger.debug(
        "resolved submission player id={} demon={} position={}",
        resolvedPlayer.id(),
        resolvedDemon.name(),
        resolvedDemon.position());
    return new ResolvedSubmission(resolvedPlayer, resolvedDemon);
  }
}
