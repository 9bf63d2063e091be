package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.model.SubmitterRecord;
import com.demonlist.leaderboard.pagination.Page;
import com.demonlist.leaderboard.pagination.PaginateCommand;
import com.demonlist.leaderboard.pagination.PlayerPagination;
import com.demonlist.leaderboard.patch.PatchCommand;
import com.demonlist.leaderboard.patch.PlayerPatch;
import com.demonlist.leaderboard.patch.PlayerPatchHandler;
import com.demonlist.leaderboard.patch.SubmitterPatch;
import com.demonlist.leaderboard.patch.SubmitterPatchHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class PlayerService {

  private final CommandQueue commandQueue;
  private final PlayerPatchHandler playerPatchHandler;
  private final SubmitterPatchHandler submitterPatchHandler;

  public Page<PlayerRecord> listPlayers(RequestData data, PlayerPagination pagination) {
    return commandQueue.submit(new PaginateCommand<>(data, pagination));
  }

  public PlayerRecord patchPlayer(RequestData data, int id, PlayerPatch patch) {
    return commandQueue.submit(new PatchCommand<>(data, id, patch, playerPatchHandler));
  }

  public SubmitterRecord patchSubmitter(RequestData data, int id, SubmitterPatch patch) {
    return commandQueue.submit(new PatchCommand<>(data, id, patch, submitterPatchHandler));
  }
}
