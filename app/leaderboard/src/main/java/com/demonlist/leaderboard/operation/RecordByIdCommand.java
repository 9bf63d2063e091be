package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.ProgressRecord;

public record RecordByIdCommand(int id) implements Command<ProgressRecord> {

  @Override
  public ProgressRecord execute(CommandScope scope) {
    return scope
        .session()
        .records()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("Record", id));
  }
}
