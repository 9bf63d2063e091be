package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.model.RecordStatus;

public record RecordPatch(
    PatchField<Integer> progress,
    PatchField<String> video,
    PatchField<RecordStatus> status,
    PatchField<String> player,
    PatchField<String> demon) {

  public RecordPatch {
    progress = PatchField.orAbsent(progress);
    video = PatchField.orAbsent(video);
    status = PatchField.orAbsent(status);
    player = PatchField.orAbsent(player);
    demon = PatchField.orAbsent(demon);
  }
}
