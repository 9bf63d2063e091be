/*
 * どこで: ページング
 * 何を: ID をキーにしたカーソル方式のページ取得と、first/last/next/prev の境界判定を行う
 * なぜ: OFFSET を使わず、件数が増えてもページ位置がずれない一覧を提供するため
 */
package com.demonlist.leaderboard.pagination;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.PermissionSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.web.util.UriComponentsBuilder;

public abstract class KeysetPagination<R> {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 100;

  private final Integer after;
  private final Integer before;
  private final int limit;

  protected KeysetPagination(Integer after, Integer before, Integer limit) {
    final int resolved = limit == null ? DEFAULT_LIMIT : limit;
    if (resolved < 1 || resolved > MAX_LIMIT) {
      throw new LeaderboardException(
          ApiErrorCode.INVALID_PAGINATION_LIMIT, "limit must be between 1 and " + MAX_LIMIT);
    }
    this.after = after;
    this.before = before;
    this.limit = resolved;
  }

  public Integer after() {
    return after;
  }

  public Integer before() {
    return before;
  }

  public int limit() {
    return limit;
  }

  public abstract String model();

  // 1 行 = 1 エンティティの SELECT。サブクエリ s として包んで絞り込む
  protected abstract String source();

  protected abstract String idColumn();

  protected abstract RowMapper<R> rowMapper();

  protected abstract int idOf(R row);

  protected abstract void filters(PageFilters filters);

  public PermissionSet requiredPermissions() {
    return PermissionSet.empty();
  }

  // 呼び出し元の権限に応じて条件を狭めたコピーを返す
  public KeysetPagination<R> restrictTo(RequestContext ctx) {
    return this;
  }

  public Page<R> fetch(NamedParameterJdbcTemplate jdbcTemplate) {
    final PageFilters filters = new PageFilters();
    filters(filters);

    if (ids(jdbcTemplate, filters, null, null, false, 1).isEmpty()) {
      return Page.empty();
    }

    final List<R> items = page(jdbcTemplate, filters);

    final Optional<String> first = Optional.of(link(filters, null, null));
    final List<Integer> tail = ids(jdbcTemplate, filters, null, null, true, limit + 1);
    final Optional<String> last =
        Optional.of(
            tail.size() > limit ? link(filters, tail.get(limit), null) : link(filters, null, null));

    final Optional<String> next;
    final Optional<String> prev;
    if (!items.isEmpty()) {
      final int min = idOf(items.get(0));
      final int max = idOf(items.get(items.size() - 1));
      next =
          ids(jdbcTemplate, filters, " > ", max, false, 1).isEmpty()
              ? Optional.empty()
              : Optional.of(link(filters, max, null));
      prev =
          ids(jdbcTemplate, filters, " < ", min, true, 1).isEmpty()
              ? Optional.empty()
              : Optional.of(link(filters, null, min));
    } else {
      // 範囲外を指した空ページ。指定された境界から前後を判断する
      next =
          before == null || ids(jdbcTemplate, filters, " >= ", before, false, 1).isEmpty()
              ? Optional.empty()
              : Optional.of(link(filters, stepBack(before), null));
      prev =
          after == null || ids(jdbcTemplate, filters, " <= ", after, true, 1).isEmpty()
              ? Optional.empty()
              : Optional.of(link(filters, null, stepForward(after)));
    }
    return new Page<>(items, new NavigationLinks(first, prev, next, last));
  }

  private List<R> page(NamedParameterJdbcTemplate jdbcTemplate, PageFilters filters) {
    final List<String> clauses = new ArrayList<>(filters.clauses());
    final Map<String, Object> params = filters.params();
    if (after != null) {
      clauses.add("s." + idColumn() + " > :after");
      params.put("after", after);
    }
    if (before != null) {
      clauses.add("s." + idColumn() + " < :before");
      params.put("before", before);
    }
    // before のみ指定された場合は直前の limit 件が欲しいので逆順に取ってから並べ直す
    final boolean descending = before != null && after == null;
    params.put("limit", limit);
    final String sql = select("*", clauses, descending) + " LIMIT :limit";
    final List<R> rows = jdbcTemplate.query(sql, new MapSqlParameterSource(params), rowMapper());
    if (!descending) {
      return rows;
    }
    final List<R> reversed = new ArrayList<>(rows);
    Collections.reverse(reversed);
    return reversed;
  }

  private List<Integer> ids(
      NamedParameterJdbcTemplate jdbcTemplate,
      PageFilters filters,
      String operator,
      Integer pivot,
      boolean descending,
      int max) {
    final List<String> clauses = new ArrayList<>(filters.clauses());
    final Map<String, Object> params = filters.params();
    if (operator != null) {
      clauses.add("s." + idColumn() + operator + ":pivot");
      params.put("pivot", pivot);
    }
    params.put("limit", max);
    final String sql = select("s." + idColumn(), clauses, descending) + " LIMIT :limit";
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(params), Integer.class);
  }

  private String select(String columns, List<String> clauses, boolean descending) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(columns)
            .append(" FROM (")
            .append(source())
            .append(") AS s");
    if (!clauses.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", clauses));
    }
    sql.append(" ORDER BY s.").append(idColumn()).append(descending ? " DESC" : " ASC");
    return sql.toString();
  }

  // 端の値でも桁あふれせず、リンクが反対側へ飛ばないよう int の範囲に留める
  static int stepBack(int cursor) {
    return cursor == Integer.MIN_VALUE ? cursor : cursor - 1;
  }

  static int stepForward(int cursor) {
    return cursor == Integer.MAX_VALUE ? cursor : cursor + 1;
  }

  private String link(PageFilters filters, Integer newAfter, Integer newBefore) {
    final UriComponentsBuilder builder =
        UriComponentsBuilder.newInstance().queryParams(filters.query()).queryParam("limit", limit);
    if (newAfter != null) {
      builder.queryParam("after", newAfter);
    }
    if (newBefore != null) {
      builder.queryParam("before", newBefore);
    }
    return builder.encode().build().getQuery();
  }
}
