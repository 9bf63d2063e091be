package com.demonlist.leaderboard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demonlist.leaderboard.TestSessions;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.Registration;
import com.demonlist.leaderboard.model.UserRecord;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

class AuthCommandsTest {

  private final TestSessions sessions = new TestSessions();
  private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
  private final AccessTokenCodec codec = mock(AccessTokenCodec.class);

  @Test
  void tokenAuthenticationResolvesTheUser() {
    final UserRecord user = TestSessions.user(4, "stardust", PermissionSet.empty());
    when(codec.decodeUnverifiedId("token")).thenReturn(4);
    when(codec.verify("token", user)).thenReturn(true);
    when(sessions.users.findById(4)).thenReturn(Optional.of(user));

    assertThat(new TokenAuthCommand(new Authorization.Token("token"), codec).execute(sessions.scope()))
        .isEqualTo(user);
  }

  @Test
  void tokenForDeletedUserIsUnauthorized() {
    when(codec.decodeUnverifiedId("token")).thenReturn(4);
    when(sessions.users.findById(4)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                new TokenAuthCommand(new Authorization.Token("token"), codec)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.UNAUTHORIZED);
  }

  @Test
  void basicCredentialsAreNotAcceptedAsToken() {
    assertThatThrownBy(
            () ->
                new TokenAuthCommand(new Authorization.Basic("stardust", "password123"), codec)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.UNAUTHORIZED);
  }

  @Test
  void wrongPasswordIsIndistinguishableFromUnknownUser() {
    final UserRecord user =
        new UserRecord(4, "stardust", null, null, PermissionSet.empty(), encoder.encode("password123"));
    when(sessions.users.findByName("stardust")).thenReturn(Optional.of(user));

    assertThatThrownBy(
            () ->
                new BasicAuthCommand(new Authorization.Basic("stardust", "wrong-password"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.UNAUTHORIZED);
    assertThatThrownBy(
            () ->
                new BasicAuthCommand(new Authorization.Basic("ghost", "password123"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.UNAUTHORIZED);
  }

  @Test
  void registrationStoresAHashNotThePassword() {
    when(sessions.users.insert(eq("stardust"), anyString()))
        .thenReturn(TestSessions.user(9, "stardust", PermissionSet.empty()));
    final ArgumentCaptor<String> hash = ArgumentCaptor.forClass(String.class);

    new RegisterCommand(new Registration("stardust", "password123"), encoder)
        .execute(sessions.scope());

    verify(sessions.users).insert(eq("stardust"), hash.capture());
    assertThat(hash.getValue()).isNotEqualTo("password123");
    assertThat(encoder.matches("password123", hash.getValue())).isTrue();
  }

  @Test
  void registrationRejectsTakenNames() {
    when(sessions.users.findByName("stardust"))
        .thenReturn(Optional.of(TestSessions.user(9, "stardust", PermissionSet.empty())));

    assertThatThrownBy(
            () ->
                new RegisterCommand(new Registration("stardust", "password123"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.NAME_TAKEN);
    verify(sessions.users, never()).insert(anyString(), anyString());
  }

  @Test
  void concurrentRegistrationOfTheSameNameIsNameTaken() {
    when(sessions.users.insert(eq("stardust"), anyString()))
        .thenThrow(new DuplicateKeyException("members_name_key"));

    assertThatThrownBy(
            () ->
                new RegisterCommand(new Registration("stardust", "password123"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.NAME_TAKEN);
  }

  @Test
  void registrationValidatesCredentials() {
    assertThatThrownBy(
            () ->
                new RegisterCommand(new Registration(" padded", "password123"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_USERNAME);
    assertThatThrownBy(
            () ->
                new RegisterCommand(new Registration("stardust", "short"), encoder)
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_PASSWORD);
  }

  @Test
  void invalidateRehashesTheSamePassword() {
    final String originalHash = encoder.encode("password123");
    final UserRecord user =
        new UserRecord(4, "stardust", null, null, PermissionSet.empty(), originalHash);
    when(sessions.users.findByName("stardust")).thenReturn(Optional.of(user));
    when(sessions.users.findById(4)).thenReturn(Optional.of(user));
    final ArgumentCaptor<UserRecord> updated = ArgumentCaptor.forClass(UserRecord.class);

    new InvalidateCommand(new Authorization.Basic("stardust", "password123"), encoder)
        .execute(sessions.scope());

    verify(sessions.session).inTransaction(any());
    verify(sessions.users).updateProfile(updated.capture());
    assertThat(updated.getValue().passwordHash()).isNotEqualTo(originalHash);
    assertThat(encoder.matches("password123", updated.getValue().passwordHash())).isTrue();
  }
}
