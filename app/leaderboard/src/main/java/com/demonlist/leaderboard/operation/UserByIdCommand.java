package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.UserRecord;

public record UserByIdCommand(int id) implements Command<UserRecord> {

  @Override
  public UserRecord execute(CommandScope scope) {
    return scope
        .session()
        .users()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("User", id));
  }
}
