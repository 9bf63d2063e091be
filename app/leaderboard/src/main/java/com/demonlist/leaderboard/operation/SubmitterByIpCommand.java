package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.SubmitterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// 提出元 IP に対応する submitter を引き、無ければ作成する
public record SubmitterByIpCommand(String ip) implements Command<SubmitterRecord> {

  private static final Logger logger = LoggerFactory.getLogger(SubmitterByIpCommand.class);

  @Override
  public SubmitterRecord execute(CommandScope scope) {
    return scope
        .session()
        .submitters()
        .findByIp(ip)
        .orElseGet(
            () -> {
              final SubmitterRecord created = scope.session().submitters().insert(ip);
              logger.debug("created submitter id={}", created.id());
              return created;
            });
  }
}
