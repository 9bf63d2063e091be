/*
 * どこで: リクエストコンテキスト
 * 何を: クライアントが最後に観測したエンティティの内容ハッシュ(If-Match 相当)を保持する
 * なぜ: 他者の更新を上書きしてしまう lost update をパッチ適用前に検出するため
 */
package com.demonlist.leaderboard.context;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

public record Precondition(Set<String> tokens) {

  private static final String ANY = "*";

  public Precondition {
    tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
  }

  public static Precondition of(String... tokens) {
    return new Precondition(new LinkedHashSet<>(Arrays.asList(tokens)));
  }

  // If-Match ヘッダ値 ("a", W/"b", *) を分解する。空なら null を返す
  public static Precondition parse(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    final Set<String> parsed =
        Arrays.stream(header.split(","))
            .map(String::trim)
            .map(token -> token.startsWith("W/") ? token.substring(2) : token)
            .map(token -> token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")
                ? token.substring(1, token.length() - 1)
                : token)
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return parsed.isEmpty() ? null : new Precondition(parsed);
  }

  public boolean met(String contentHash) {
    return tokens.contains(ANY) || tokens.contains(contentHash);
  }
}
