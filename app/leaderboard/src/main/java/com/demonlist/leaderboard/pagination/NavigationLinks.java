/*
 * どこで: ページング
 * 何を: first/prev/next/last の 4 つのクエリ文字列をまとめ、Link ヘッダ形式で出力する
 * なぜ: 呼び出し側がページング情報をそのままレスポンスに載せられるようにするため
 */
package com.demonlist.leaderboard.pagination;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record NavigationLinks(
    Optional<String> first, Optional<String> prev, Optional<String> next, Optional<String> last) {

  private static final NavigationLinks NONE =
      new NavigationLinks(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

  public NavigationLinks {
    first = first == null ? Optional.empty() : first;
    prev = prev == null ? Optional.empty() : prev;
    next = next == null ? Optional.empty() : next;
    last = last == null ? Optional.empty() : last;
  }

  public static NavigationLinks none() {
    return NONE;
  }

  // 例: <?limit=50>; rel=first,<?limit=50&after=70>; rel=last  (無いものは出力しない)
  public String toLinkHeader() {
    final List<String> parts = new ArrayList<>(4);
    first.ifPresent(query -> parts.add(entry(query, "first")));
    prev.ifPresent(query -> parts.add(entry(query, "prev")));
    next.ifPresent(query -> parts.add(entry(query, "next")));
    last.ifPresent(query -> parts.add(entry(query, "last")));
    return String.join(",", parts);
  }

  private static String entry(String query, String rel) {
    return "<?" + query + ">; rel=" + rel;
  }
}
