package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.UserRecord;

public record UserByNameCommand(String name) implements Command<UserRecord> {

  @Override
  public UserRecord execute(CommandScope scope) {
    return scope
        .session()
        .users()
        .findByName(name)
        .orElseThrow(() -> new ModelNotFoundException("User", name));
  }
}
