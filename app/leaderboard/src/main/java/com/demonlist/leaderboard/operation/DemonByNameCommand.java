package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.DemonRecord;

public record DemonByNameCommand(String name) implements Command<DemonRecord> {

  @Override
  public DemonRecord execute(CommandScope scope) {
    if (name == null || name.isBlank()) {
      throw new LeaderboardException(ApiErrorCode.INVALID_NAME, "demon name must not be blank");
    }
    return scope
        .session()
        .demons()
        .findByName(name.trim())
        .orElseThrow(() -> new ModelNotFoundException("Demon", name));
  }
}
