/*
 * どこで: 共通ユーティリティ
 * 何を: 比較対象となるフィールドから内容ハッシュを導出できる型を表す
 * なぜ: 楽観的排他制御のトークン(If-Match)をエンティティ横断で同じ方法で計算するため
 */
package com.demonlist.common;

import java.util.Map;

public interface ContentAddressable {

  // 比較に使うフィールドのみを返す。秘密情報は含めないこと
  Map<String, Object> contentFields();

  default String contentHash() {
    return ContentHashes.sha256Hex(contentFields());
  }
}
