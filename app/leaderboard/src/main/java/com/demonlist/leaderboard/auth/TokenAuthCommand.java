package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.UserByIdCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// 未検証のまま ID を読み、ユーザーを引いてからそのユーザーの鍵で署名を検証する
public record TokenAuthCommand(Authorization authorization, AccessTokenCodec codec)
    implements Command<UserRecord> {

  private static final Logger logger = LoggerFactory.getLogger(TokenAuthCommand.class);

  @Override
  public UserRecord execute(CommandScope scope) {
    if (!(authorization instanceof Authorization.Token token)) {
      throw LeaderboardException.unauthorized();
    }
    final int id = codec.decodeUnverifiedId(token.token());
    final UserRecord user;
    try {
      user = scope.dispatch(new UserByIdCommand(id));
    } catch (ModelNotFoundException ex) {
      logger.debug("token refers to unknown user id={}", id);
      throw LeaderboardException.unauthorized();
    }
    if (!codec.verify(token.token(), user)) {
      logger.debug("token signature rejected for user id={}", id);
      throw LeaderboardException.unauthorized();
    }
    return user;
  }
}
