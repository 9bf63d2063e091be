package com.demonlist.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContentHashesTest {

  @Test
  void hashIgnoresInsertionOrder() {
    final Map<String, Object> first = new LinkedHashMap<>();
    first.put("name", "Bloodbath");
    first.put("position", 3);
    final Map<String, Object> second = new LinkedHashMap<>();
    second.put("position", 3);
    second.put("name", "Bloodbath");

    assertThat(ContentHashes.sha256Hex(first)).isEqualTo(ContentHashes.sha256Hex(second));
  }

  @Test
  void hashChangesWhenValueChanges() {
    final Map<String, Object> before = new LinkedHashMap<>();
    before.put("position", 3);
    final Map<String, Object> after = new LinkedHashMap<>();
    after.put("position", 4);

    assertThat(ContentHashes.sha256Hex(before)).isNotEqualTo(ContentHashes.sha256Hex(after));
  }

  @Test
  void hashAcceptsNullValues() {
    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("video", null);

    // SHA-256 は 64 桁の 16 進文字列になる
    assertThat(ContentHashes.sha256Hex(fields)).hasSize(64).matches("[0-9a-f]+");
  }
}
