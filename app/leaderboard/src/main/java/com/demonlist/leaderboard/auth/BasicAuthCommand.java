package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.UserByNameCommand;
import org.springframework.security.crypto.password.PasswordEncoder;

// 失敗理由(ユーザー不在/パスワード不一致)は区別せず UNAUTHORIZED にする
public record BasicAuthCommand(Authorization authorization, PasswordEncoder passwordEncoder)
    implements Command<UserRecord> {

  @Override
  public UserRecord execute(CommandScope scope) {
    if (!(authorization instanceof Authorization.Basic basic)) {
      throw LeaderboardException.unauthorized();
    }
    final UserRecord user;
    try {
      user = scope.dispatch(new UserByNameCommand(basic.username()));
    } catch (ModelNotFoundException ex) {
      throw LeaderboardException.unauthorized();
    }
    if (basic.password() == null || !passwordEncoder.matches(basic.password(), user.passwordHash())) {
      throw LeaderboardException.unauthorized();
    }
    return user;
  }
}
