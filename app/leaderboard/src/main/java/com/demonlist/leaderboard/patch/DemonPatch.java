package com.demonlist.leaderboard.patch;

public record DemonPatch(
    PatchField<String> name,
    PatchField<Integer> position,
    PatchField<String> video,
    PatchField<Integer> requirement,
    PatchField<String> verifier,
    PatchField<String> publisher) {

  public DemonPatch {
    name = PatchField.orAbsent(name);
    position = PatchField.orAbsent(position);
    video = PatchField.orAbsent(video);
    requirement = PatchField.orAbsent(requirement);
    verifier = PatchField.orAbsent(verifier);
    publisher = PatchField.orAbsent(publisher);
  }
}
