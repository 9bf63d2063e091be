package com.demonlist.leaderboard.patch;

public record PlayerPatch(PatchField<String> name, PatchField<Boolean> banned) {

  public PlayerPatch {
    name = PatchField.orAbsent(name);
    banned = PatchField.orAbsent(banned);
  }
}
