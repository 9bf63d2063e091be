package com.demonlist.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CommandIdsTest {

  @Test
  void idsAreShortHexAndDistinct() {
    final String first = CommandIds.next();

    assertThat(first).hasSize(16).matches("[0-9a-f]+");
    assertThat(CommandIds.next()).isNotEqualTo(first);
  }
}
