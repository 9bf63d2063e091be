/*
 * どこで: デーモン操作
 * 何を: 新しいデーモンを指定順位に挿入し、以降のデーモンを 1 つずつ繰り下げる
 * なぜ: 順位の一意性を保ったまま途中挿入するには、繰り下げと挿入を同じトランザクションで行う必要があるため
 */
package com.demonlist.leaderboard.operation;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.NewDemon;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.repository.DemonRepository;
import com.demonlist.leaderboard.video.VideoValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record InsertDemonCommand(RequestData data, NewDemon demon, VideoValidator videoValidator)
    implements Command<DemonRecord> {

  private static final Logger logger = LoggerFactory.getLogger(InsertDemonCommand.class);

  @Override
  public DemonRecord execute(CommandScope scope) {
    final RequestContext ctx = scope.bind(data);
    ctx.checkPermissions(PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR));

    final DemonRepository demons = ctx.session().demons();
    final String name = DemonRules.validateName(demon.name(), null, demons);
    // 末尾への追加も許すので上限は件数 + 1
    DemonRules.validatePosition(demon.position(), demons.count() + 1);
    DemonRules.validateRequirement(demon.requirement());
    final String video = demon.video() == null ? null : videoValidator.validate(demon.video());

    final PlayerRecord verifier = scope.dispatch(new PlayerByNameCommand(demon.verifier()));
    final PlayerRecord publisher = scope.dispatch(new PlayerByNameCommand(demon.publisher()));
    final DemonRecord created =
        new DemonRecord(name, demon.position(), demon.requirement(), video, verifier, publisher);

    ctx.session()
        .inTransaction(
            () -> {
              demons.shiftDownFrom(created.position());
              demons.insert(created);
              return created;
            });
    logger.info("inserted demon name={} position={}", created.name(), created.position());
    return created;
  }
}
