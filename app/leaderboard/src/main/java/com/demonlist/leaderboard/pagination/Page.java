package com.demonlist.leaderboard.pagination;

import java.util.List;

public record Page<R>(List<R> items, NavigationLinks links) {

  public Page {
    items = List.copyOf(items);
  }

  public static <R> Page<R> empty() {
    return new Page<>(List.of(), NavigationLinks.none());
  }
}
