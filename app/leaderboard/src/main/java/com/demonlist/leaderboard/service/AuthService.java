package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.auth.AccessTokenCodec;
import com.demonlist.leaderboard.auth.Authorization;
import com.demonlist.leaderboard.auth.BasicAuthCommand;
import com.demonlist.leaderboard.auth.InvalidateCommand;
import com.demonlist.leaderboard.auth.RegisterCommand;
import com.demonlist.leaderboard.auth.TokenAuthCommand;
import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.model.Registration;
import com.demonlist.leaderboard.model.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuthService {

  private final CommandQueue commandQueue;
  private final PasswordEncoder passwordEncoder;
  private final AccessTokenCodec accessTokenCodec;

  public UserRecord register(Registration registration) {
    return commandQueue.submit(new RegisterCommand(registration, passwordEncoder));
  }

  // Basic 認証に成功したらアクセストークンを発行する
  public String login(Authorization authorization) {
    final UserRecord user =
        commandQueue.submit(new BasicAuthCommand(authorization, passwordEncoder));
    return accessTokenCodec.issue(user);
  }

  public UserRecord authenticate(Authorization authorization) {
    if (authorization instanceof Authorization.Basic) {
      return commandQueue.submit(new BasicAuthCommand(authorization, passwordEncoder));
    }
    return commandQueue.submit(new TokenAuthCommand(authorization, accessTokenCodec));
  }

  public void invalidate(Authorization authorization) {
    commandQueue.submit(new InvalidateCommand(authorization, passwordEncoder));
  }
}
