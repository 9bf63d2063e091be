package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.model.Registration;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.UserRules;
import com.demonlist.leaderboard.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;

public record RegisterCommand(Registration registration, PasswordEncoder passwordEncoder)
    implements Command<UserRecord> {

  private static final Logger logger = LoggerFactory.getLogger(RegisterCommand.class);

  @Override
  public UserRecord execute(CommandScope scope) {
    UserRules.validateUsername(registration.name());
    UserRules.validatePassword(registration.password());

    final UserRepository users = scope.session().users();
    if (users.findByName(registration.name()).isPresent()) {
      throw nameTaken();
    }
    final UserRecord created;
    try {
      created = users.insert(registration.name(), passwordEncoder.encode(registration.password()));
    } catch (DuplicateKeyException ex) {
      // 存在確認と挿入の間に同名が登録された
      throw nameTaken();
    }
    logger.info("registered user id={} name={}", created.id(), created.name());
    return created;
  }

  private static LeaderboardException nameTaken() {
    return new LeaderboardException(ApiErrorCode.NAME_TAKEN, "the chosen username is already taken");
  }
}
