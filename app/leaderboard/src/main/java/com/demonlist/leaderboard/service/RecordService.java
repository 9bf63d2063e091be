package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.operation.DeleteRecordByIdCommand;
import com.demonlist.leaderboard.operation.RecordByIdCommand;
import com.demonlist.leaderboard.pagination.Page;
import com.demonlist.leaderboard.pagination.PaginateCommand;
import com.demonlist.leaderboard.pagination.RecordPagination;
import com.demonlist.leaderboard.patch.PatchCommand;
import com.demonlist.leaderboard.patch.RecordPatch;
import com.demonlist.leaderboard.patch.RecordPatchHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class RecordService {

  private final CommandQueue commandQueue;
  private final RecordPatchHandler recordPatchHandler;

  public ProgressRecord getRecord(int id) {
    return commandQueue.submit(new RecordByIdCommand(id));
  }

  public Page<ProgressRecord> listRecords(RequestData data, RecordPagination pagination) {
    return commandQueue.submit(new PaginateCommand<>(data, pagination));
  }

  public ProgressRecord patchRecord(RequestData data, int id, RecordPatch patch) {
    return commandQueue.submit(new PatchCommand<>(data, id, patch, recordPatchHandler));
  }

  public void deleteRecord(RequestData data, int id) {
    commandQueue.submit(new DeleteRecordByIdCommand(data, id));
  }
}
