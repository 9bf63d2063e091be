package com.demonlist.leaderboard.pagination;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

// 1 つのページング要求の絞り込み条件。SQL の条件とナビゲーション用クエリ文字列を同時に組み立てる
public final class PageFilters {

  private final List<String> clauses = new ArrayList<>();
  private final Map<String, Object> params = new LinkedHashMap<>();
  private final MultiValueMap<String, String> query = new LinkedMultiValueMap<>();

  // value が null の条件は無視する
  public PageFilters equalTo(String column, String name, Object value) {
    return add("s." + column + " = :" + name, name, value);
  }

  public PageFilters equalToIgnoreCase(String column, String name, String value) {
    return add("lower(s." + column + ") = lower(:" + name + ")", name, value);
  }

  public PageFilters add(String clause, String name, Object value) {
    if (value == null) {
      return this;
    }
    clauses.add(clause);
    params.put(name, value);
    query.add(name, String.valueOf(value));
    return this;
  }

  List<String> clauses() {
    return List.copyOf(clauses);
  }

  Map<String, Object> params() {
    return new LinkedHashMap<>(params);
  }

  MultiValueMap<String, String> query() {
    return new LinkedMultiValueMap<>(query);
  }
}
