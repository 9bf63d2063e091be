package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.DeleteUserByIdCommand;
import com.demonlist.leaderboard.operation.UserByIdCommand;
import com.demonlist.leaderboard.pagination.Page;
import com.demonlist.leaderboard.pagination.PaginateCommand;
import com.demonlist.leaderboard.pagination.UserPagination;
import com.demonlist.leaderboard.patch.PatchCommand;
import com.demonlist.leaderboard.patch.PatchMe;
import com.demonlist.leaderboard.patch.PatchSelfCommand;
import com.demonlist.leaderboard.patch.UserPatch;
import com.demonlist.leaderboard.patch.UserPatchHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserService {

  private final CommandQueue commandQueue;
  private final UserPatchHandler userPatchHandler;
  private final PasswordEncoder passwordEncoder;

  public UserRecord getUser(int id) {
    return commandQueue.submit(new UserByIdCommand(id));
  }

  public Page<UserRecord> listUsers(RequestData data, UserPagination pagination) {
    return commandQueue.submit(new PaginateCommand<>(data, pagination));
  }

  public UserRecord patchUser(RequestData data, int id, UserPatch patch) {
    return commandQueue.submit(new PatchCommand<>(data, id, patch, userPatchHandler));
  }

  public UserRecord patchMe(RequestData data, UserRecord me, PatchMe patch) {
    return commandQueue.submit(new PatchSelfCommand(data, me, patch, passwordEncoder));
  }

  public void deleteUser(RequestData data, int id) {
    commandQueue.submit(new DeleteUserByIdCommand(data, id));
  }
}
