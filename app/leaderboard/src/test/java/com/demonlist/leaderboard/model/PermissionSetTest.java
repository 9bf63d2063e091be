package com.demonlist.leaderboard.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PermissionSetTest {

  @Test
  void bitsRoundTripThroughStorageRepresentation() {
    final PermissionSet permissions =
        PermissionSet.of(Permission.LIST_HELPER, Permission.ADMINISTRATOR);

    assertThat(permissions.bits()).isEqualTo(0b10 | 0b100_0000_0000_0000);
    assertThat(PermissionSet.fromBits(permissions.bits())).isEqualTo(permissions);
  }

  @Test
  void intersectsIsSatisfiedByAnySingleMember() {
    final PermissionSet granted = PermissionSet.of(Permission.LIST_MODERATOR);

    assertThat(
            granted.intersects(
                PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR)))
        .isTrue();
    assertThat(granted.intersects(PermissionSet.of(Permission.ADMINISTRATOR))).isFalse();
    assertThat(granted.intersects(PermissionSet.empty())).isFalse();
  }

  @Test
  void impliedExpandsTheWholeChain() {
    final PermissionSet implied = PermissionSet.of(Permission.LIST_ADMINISTRATOR).implied();

    assertThat(implied.permissions())
        .containsExactlyInAnyOrder(
            Permission.LIST_ADMINISTRATOR, Permission.LIST_MODERATOR, Permission.LIST_HELPER);
  }

  @Test
  void userWithAdministratorSatisfiesModeratorRequirement() {
    final UserRecord admin =
        new UserRecord(1, "admin", null, null, PermissionSet.of(Permission.ADMINISTRATOR), "hash");

    assertThat(admin.hasAny(PermissionSet.of(Permission.MODERATOR))).isTrue();
    assertThat(admin.hasAny(PermissionSet.of(Permission.LIST_HELPER))).isFalse();
  }

  @Test
  void toStringListsAlternatives() {
    assertThat(PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR))
        .hasToString("[LIST_MODERATOR or LIST_ADMINISTRATOR]");
  }
}
