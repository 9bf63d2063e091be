package com.demonlist.leaderboard.patch;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demonlist.leaderboard.TestSessions;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.context.Precondition;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.model.SubmitterRecord;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class PlayerPatchHandlerTest {

  private final TestSessions sessions = new TestSessions();
  private final PlayerRecord player = TestSessions.player(3, "Cheater");

  @Test
  void banningAPlayerClearsPendingAndRejectsTheRest() {
    when(sessions.players.findById(3)).thenReturn(Optional.of(player));

    new PatchCommand<>(
            data(player.contentHash()),
            3,
            new PlayerPatch(null, PatchField.of(true)),
            new PlayerPatchHandler())
        .execute(sessions.scope());

    final InOrder order = inOrder(sessions.players, sessions.records);
    order.verify(sessions.players).update(player.withBanned(true));
    order.verify(sessions.records).deleteSubmittedByPlayer(3);
    order.verify(sessions.records).rejectAllByPlayer(3);
  }

  @Test
  void renamingToAnExistingNameFails() {
    when(sessions.players.findById(3)).thenReturn(Optional.of(player));
    when(sessions.players.existsOtherWithName("Taken", 3)).thenReturn(true);

    assertThatThrownBy(
            () ->
                new PatchCommand<>(
                        data(player.contentHash()),
                        3,
                        new PlayerPatch(PatchField.of("Taken"), null),
                        new PlayerPatchHandler())
                    .execute(sessions.scope()))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.NAME_TAKEN);
  }

  @Test
  void banningASubmitterDropsOnlyPendingSubmissions() {
    final SubmitterRecord submitter = new SubmitterRecord(9, "10.0.0.9", false);
    when(sessions.submitters.findById(9)).thenReturn(Optional.of(submitter));

    new PatchCommand<>(
            data(submitter.contentHash()),
            9,
            new SubmitterPatch(PatchField.of(true)),
            new SubmitterPatchHandler())
        .execute(sessions.scope());

    verify(sessions.submitters).updateBanned(9, true);
    verify(sessions.records).deleteSubmittedBySubmitter(9);
    verify(sessions.records, never()).rejectAllByPlayer(anyInt());
  }

  private RequestData data(String hash) {
    return RequestData.external("10.0.0.1")
        .withUser(TestSessions.user(1, "mod", PermissionSet.of(Permission.LIST_ADMINISTRATOR)))
        .withPrecondition(Precondition.of(hash));
  }
}
