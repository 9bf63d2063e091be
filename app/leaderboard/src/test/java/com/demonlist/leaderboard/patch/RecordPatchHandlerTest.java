package com.demonlist.leaderboard.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demonlist.leaderboard.TestSessions;
import com.demonlist.leaderboard.api.InvalidProgressException;
import com.demonlist.leaderboard.context.Precondition;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.EmbeddedDemon;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.RecordStatus;
import com.demonlist.leaderboard.video.VideoValidator;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordPatchHandlerTest {

  private final TestSessions sessions = new TestSessions();
  private final RecordPatchHandler handler = new RecordPatchHandler(mock(VideoValidator.class));
  private final ProgressRecord record =
      new ProgressRecord(
          11,
          60,
          null,
          RecordStatus.SUBMITTED,
          TestSessions.player(3, "Alice"),
          9,
          new EmbeddedDemon("Bloodbath", 3));

  @BeforeEach
  void setUp() {
    when(sessions.records.findById(11)).thenReturn(Optional.of(record));
    when(sessions.demons.findByName("Bloodbath"))
        .thenReturn(Optional.of(TestSessions.demon("Bloodbath", 3, 50)));
    when(sessions.demons.findByName("Sonic Wave"))
        .thenReturn(Optional.of(TestSessions.demon("Sonic Wave", 5, 70)));
  }

  @Test
  void movingToAHarderDemonRevalidatesProgress() {
    assertThatThrownBy(
            () -> run(new RecordPatch(null, null, null, null, PatchField.of("Sonic Wave"))))
        .isInstanceOfSatisfying(
            InvalidProgressException.class, ex -> assertThat(ex.requirement()).isEqualTo(70));
    verify(sessions.records, never()).update(any());
  }

  @Test
  void helperApprovesRecord() {
    final ProgressRecord result =
        run(new RecordPatch(null, null, PatchField.of(RecordStatus.APPROVED), null, null));

    assertThat(result.status()).isEqualTo(RecordStatus.APPROVED);
    verify(sessions.records).update(result);
  }

  @Test
  void progressAboveHundredIsRejected() {
    assertThatThrownBy(() -> run(new RecordPatch(PatchField.of(101), null, null, null, null)))
        .isInstanceOf(InvalidProgressException.class);
  }

  private ProgressRecord run(RecordPatch patch) {
    final RequestData data =
        RequestData.external("10.0.0.1")
            .withUser(TestSessions.user(1, "helper", PermissionSet.of(Permission.LIST_HELPER)))
            .withPrecondition(Precondition.of(record.contentHash()));
    return new PatchCommand<>(data, 11, patch, handler).execute(sessions.scope());
  }
}
