/*
 * どこで: パッチプロトコル (自分自身)
 * 何を: ログイン中のユーザーが自分のパスワード/表示名/YouTube チャンネルを変更する
 * なぜ: 自分の情報は権限なしで変更できるが、前提条件と検証は他のパッチと同じ順序で行うため
 */
package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.operation.UserRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

public record PatchSelfCommand(
    RequestData data, UserRecord user, PatchMe patch, PasswordEncoder passwordEncoder)
    implements Command<UserRecord> {

  private static final Logger logger = LoggerFactory.getLogger(PatchSelfCommand.class);

  @Override
  public UserRecord execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    // 呼び出し側が持つレコードは古い可能性があるので、前提条件は最新の行と比べる
    final UserRecord current =
        ctx.session()
            .users()
            .findById(user.id())
            .orElseThrow(() -> new ModelNotFoundException("User", user.id()));
    ctx.checkPrecondition(current);

    UserRecord patched = current;
    if (patch.password().isPresent()) {
      final String password = patch.password().value();
      UserRules.validatePassword(password);
      patched = patched.withPasswordHash(passwordEncoder.encode(password));
    }
    if (patch.displayName().isPresent()) {
      patched = patched.withDisplayName(UserRules.validateDisplayName(patch.displayName().value()));
    }
    if (patch.youtubeChannel().isPresent()) {
      patched = patched.withYoutubeChannel(UserRules.normalizeChannel(patch.youtubeChannel().value()));
    }

    final UserRecord result = patched;
    ctx.session()
        .inTransaction(
            () -> {
              ctx.session().users().updateProfile(result);
              return result;
            });
    if (patch.password().isPresent()) {
      logger.info("user id={} changed their password", user.id());
    }
    return result;
  }

  @Override
  public String name() {
    return "PatchSelf";
  }
}
