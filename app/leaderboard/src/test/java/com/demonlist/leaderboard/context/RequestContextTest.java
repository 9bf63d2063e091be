/*
 * どこで: リクエストコンテキストのテスト
 * 何を: 権限検査と前提条件(If-Match)検査の各分岐を検証する
 * なぜ: 認可と楽観的排他制御がすべての書き込みの前提になるため
 */
package com.demonlist.leaderboard.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.demonlist.leaderboard.TestSessions;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.MissingPermissionsException;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.store.StoreSession;
import org.junit.jupiter.api.Test;

class RequestContextTest {

  private static final PermissionSet LIST_MOD =
      PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR);

  private final StoreSession session = mock(StoreSession.class);
  private final DemonRecord demon = TestSessions.demon("Bloodbath", 3, 50);

  @Test
  void emptyRequirementAlwaysPasses() {
    final RequestContext ctx = RequestData.external("10.0.0.1").bind(session);

    assertThatCode(() -> ctx.checkPermissions(PermissionSet.empty())).doesNotThrowAnyException();
  }

  @Test
  void anonymousCallerIsUnauthorized() {
    final RequestContext ctx = RequestData.external("10.0.0.1").bind(session);

    assertThatThrownBy(() -> ctx.checkPermissions(LIST_MOD))
        .isInstanceOf(LeaderboardException.class)
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.UNAUTHORIZED);
  }

  @Test
  void callerWithoutIntersectionReportsRequiredSet() {
    final UserRecord helper =
        TestSessions.user(1, "helper", PermissionSet.of(Permission.LIST_HELPER));
    final RequestContext ctx = RequestData.external("10.0.0.1").withUser(helper).bind(session);

    assertThatThrownBy(() -> ctx.checkPermissions(LIST_MOD))
        .isInstanceOfSatisfying(
            MissingPermissionsException.class,
            ex -> assertThat(ex.required()).isEqualTo(LIST_MOD));
  }

  @Test
  void internalContextBypassesEveryCheck() {
    final RequestContext ctx = RequestData.internal().bind(session);

    assertThatCode(
            () -> {
              ctx.checkPermissions(PermissionSet.of(Permission.ADMINISTRATOR));
              ctx.checkPrecondition(demon);
            })
        .doesNotThrowAnyException();
    assertThat(ctx.isListModerator()).isTrue();
  }

  @Test
  void preconditionComputedFromEntityIsAccepted() {
    final RequestContext ctx =
        RequestData.external("10.0.0.1")
            .withPrecondition(Precondition.of(demon.contentHash()))
            .bind(session);

    assertThatCode(() -> ctx.checkPrecondition(demon)).doesNotThrowAnyException();
  }

  @Test
  void modifiedEntityFailsPrecondition() {
    final RequestContext ctx =
        RequestData.external("10.0.0.1")
            .withPrecondition(Precondition.of(demon.contentHash()))
            .bind(session);

    assertThatThrownBy(() -> ctx.checkPrecondition(demon.withPosition(4)))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.PRECONDITION_FAILED);
  }

  @Test
  void missingPreconditionIsAnInternalError() {
    final RequestContext ctx = RequestData.external("10.0.0.1").bind(session);

    assertThatThrownBy(() -> ctx.checkPrecondition(demon))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_STATE);
  }

  @Test
  void wildcardPreconditionMatchesAnything() {
    final Precondition any = Precondition.parse("*");

    assertThat(any.met(demon.contentHash())).isTrue();
  }

  @Test
  void parseStripsQuotesAndWeakPrefix() {
    final Precondition parsed = Precondition.parse("\"abc\", W/\"def\"");

    assertThat(parsed.tokens()).containsExactlyInAnyOrder("abc", "def");
    assertThat(Precondition.parse("  ")).isNull();
  }

  @Test
  void listAdministratorCountsAsListModerator() {
    final UserRecord admin =
        TestSessions.user(1, "admin", PermissionSet.of(Permission.LIST_ADMINISTRATOR));
    final UserRecord helper =
        TestSessions.user(2, "helper", PermissionSet.of(Permission.LIST_HELPER));

    assertThat(RequestData.external("ip").withUser(admin).bind(session).isListModerator()).isTrue();
    assertThat(RequestData.external("ip").withUser(helper).bind(session).isListModerator()).isFalse();
    assertThat(RequestData.external("ip").withUser(helper).bind(session).isListHelper()).isTrue();
    assertThat(RequestData.external("ip").bind(session).isListModerator()).isFalse();
  }
}
