package com.demonlist.leaderboard.patch;

public record SubmitterPatch(PatchField<Boolean> banned) {

  public SubmitterPatch {
    banned = PatchField.orAbsent(banned);
  }
}
