package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.model.PermissionSet;

public record UserPatch(
    PatchField<String> displayName,
    PatchField<String> youtubeChannel,
    PatchField<PermissionSet> permissions) {

  public UserPatch {
    displayName = PatchField.orAbsent(displayName);
    youtubeChannel = PatchField.orAbsent(youtubeChannel);
    permissions = PatchField.orAbsent(permissions);
  }
}
