package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.PlayerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// 名前でプレイヤーを引き、存在しなければその場で作成する
public record PlayerByNameCommand(String name) implements Command<PlayerRecord> {

  private static final Logger logger = LoggerFactory.getLogger(PlayerByNameCommand.class);

  @Override
  public PlayerRecord execute(CommandScope scope) {
    if (name == null || name.isBlank()) {
      throw new LeaderboardException(ApiErrorCode.INVALID_NAME, "player name must not be blank");
    }
    final String trimmed = name.trim();
    return scope
        .session()
        .players()
        .findByName(trimmed)
        .orElseGet(
            () -> {
              final PlayerRecord created = scope.session().players().insert(trimmed);
              logger.debug("created player id={} name={}", created.id(), created.name());
              return created;
            });
  }
}
