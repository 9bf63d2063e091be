package com.demonlist.leaderboard.patch;

public record PatchMe(
    PatchField<String> password,
    PatchField<String> displayName,
    PatchField<String> youtubeChannel) {

  public PatchMe {
    password = PatchField.orAbsent(password);
    displayName = PatchField.orAbsent(displayName);
    youtubeChannel = PatchField.orAbsent(youtubeChannel);
  }

  public static PatchMe password(String newPassword) {
    return new PatchMe(PatchField.of(newPassword), null, null);
  }

  // パスワードを含むのでログに出さない
  @Override
  public String toString() {
    return "PatchMe[password="
        + (password.isPresent() ? "***" : "absent")
        + ", displayName="
        + displayName
        + ", youtubeChannel="
        + youtubeChannel
        + "]";
  }
}
