package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.patch.PatchMe;
import com.demonlist.leaderboard.patch.PatchSelfCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

// 同じパスワードで再ハッシュすると署名鍵が変わり、発行済みトークンがすべて無効になる
public record InvalidateCommand(Authorization authorization, PasswordEncoder passwordEncoder)
    implements Command<Void> {

  private static final Logger logger = LoggerFactory.getLogger(InvalidateCommand.class);

  @Override
  public Void execute(CommandScope scope) {
    final UserRecord user = scope.dispatch(new BasicAuthCommand(authorization, passwordEncoder));
    final String password = ((Authorization.Basic) authorization).password();
    scope.dispatch(
        new PatchSelfCommand(RequestData.internal(), user, PatchMe.password(password), passwordEncoder));
    logger.info("invalidated access tokens of user id={}", user.id());
    return null;
  }
}
