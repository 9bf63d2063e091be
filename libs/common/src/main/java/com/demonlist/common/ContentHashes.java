/*
 * どこで: 共通ユーティリティ
 * 何を: フィールドの正規化 JSON から SHA-256 ハッシュを生成する
 * なぜ: プロセス再起動をまたいでも同一内容なら同一ハッシュになる必要があるため
 */
package com.demonlist.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

public final class ContentHashes {

  // アプリ側の ObjectMapper 設定に左右されないよう専用インスタンスを使う
  private static final ObjectMapper CANONICAL_MAPPER =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

  private ContentHashes() {}

  public static String sha256Hex(Map<String, ?> fields) {
    try {
      final String json = CANONICAL_MAPPER.writeValueAsString(fields);
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize content for hashing", ex);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private static String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
