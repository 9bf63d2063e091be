package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.NewDemon;
import com.demonlist.leaderboard.operation.DemonByNameCommand;
import com.demonlist.leaderboard.operation.InsertDemonCommand;
import com.demonlist.leaderboard.patch.DemonPatch;
import com.demonlist.leaderboard.patch.DemonPatchHandler;
import com.demonlist.leaderboard.patch.PatchCommand;
import com.demonlist.leaderboard.video.VideoValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class DemonService {

  private final CommandQueue commandQueue;
  private final DemonPatchHandler demonPatchHandler;
  private final VideoValidator videoValidator;

  public DemonRecord getDemon(String name) {
    return commandQueue.submit(new DemonByNameCommand(name));
  }

  public DemonRecord insertDemon(RequestData data, NewDemon demon) {
    return commandQueue.submit(new InsertDemonCommand(data, demon, videoValidator));
  }

  public DemonRecord patchDemon(RequestData data, String name, DemonPatch patch) {
    return commandQueue.submit(new PatchCommand<>(data, name, patch, demonPatchHandler));
  }
}
