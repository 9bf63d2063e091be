package com.demonlist.leaderboard.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.demonlist.leaderboard.TestSessions;
import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.MissingPermissionsException;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.RecordStatus;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class PaginateCommandTest {

  private final TestSessions sessions = new TestSessions();
  private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);

  @BeforeEach
  void setUp() {
    when(sessions.session.jdbcTemplate()).thenReturn(jdbc);
  }

  @Test
  void emptyResultHasNoLinks() {
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of());

    final Page<PlayerRecord> page = players(new PlayerPagination(null, null, null, "nobody", null));

    assertThat(page.items()).isEmpty();
    assertThat(page.links()).isEqualTo(NavigationLinks.none());
    verify(jdbc, never())
        .query(anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<Object>>any());
  }

  @Test
  void firstPageLinksForwardAndToTheLastPage() {
    // 非空判定 -> 末尾 limit+1 件 -> next 判定 -> prev 判定 の順に呼ばれる
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of(1), List.of(3, 2, 1), List.of(3), List.of());
    when(jdbc.query(
            anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<PlayerRecord>>any()))
        .thenReturn(List.of(TestSessions.player(1, "A"), TestSessions.player(2, "B")));

    final Page<PlayerRecord> page = players(new PlayerPagination(null, null, 2, null, null));

    assertThat(page.items()).extracting(PlayerRecord::id).containsExactly(1, 2);
    assertThat(page.links().first()).contains("limit=2");
    assertThat(page.links().next()).contains("limit=2&after=2");
    assertThat(page.links().last()).contains("limit=2&after=1");
    assertThat(page.links().prev()).isEmpty();
  }

  @Test
  void filtersAreCarriedIntoLinks() {
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of(4), List.of(4), List.of(), List.of());
    when(jdbc.query(
            anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<PlayerRecord>>any()))
        .thenReturn(List.of(TestSessions.player(4, "Alice")));

    final Page<PlayerRecord> page = players(new PlayerPagination(null, null, 10, "alice", null));

    assertThat(page.links().first()).contains("name=alice&limit=10");
    assertThat(page.links().next()).isEmpty();
  }

  @Test
  void cursorsAtTheIntRangeEdgesDoNotWrapAround() {
    // 非空判定 -> 末尾 -> 境界判定。該当行が無い空ページになる
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of(1), List.of(1), List.of(1));

    final Page<PlayerRecord> beforeMin =
        players(new PlayerPagination(null, Integer.MIN_VALUE, 10, null, null));
    assertThat(beforeMin.items()).isEmpty();
    assertThat(beforeMin.links().next()).contains("limit=10&after=" + Integer.MIN_VALUE);

    final Page<PlayerRecord> afterMax =
        players(new PlayerPagination(Integer.MAX_VALUE, null, 10, null, null));
    assertThat(afterMax.items()).isEmpty();
    assertThat(afterMax.links().prev()).contains("limit=10&before=" + Integer.MAX_VALUE);
  }

  @Test
  void limitOutsideRangeIsRejected() {
    assertThatThrownBy(() -> new PlayerPagination(null, null, 0, null, null))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_PAGINATION_LIMIT);
    assertThatThrownBy(() -> new PlayerPagination(null, null, 101, null, null))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_PAGINATION_LIMIT);
  }

  @Test
  void anonymousCallersOnlySeeApprovedRecords() {
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of());
    final ArgumentCaptor<SqlParameterSource> params =
        ArgumentCaptor.forClass(SqlParameterSource.class);

    final Page<ProgressRecord> page =
        new PaginateCommand<>(
                RequestData.external("10.0.0.1"),
                new RecordPagination(null, null, null, null, null, RecordStatus.SUBMITTED))
            .execute(sessions.scope());

    assertThat(page.items()).isEmpty();
    verify(jdbc).queryForList(anyString(), params.capture(), eq(Integer.class));
    assertThat(params.getValue().getValue("status")).isEqualTo("APPROVED");
  }

  @Test
  void replacedStatusFilterShowsUpInTheLinks() {
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of(8), List.of(8), List.of(), List.of());

    final Page<ProgressRecord> page =
        new PaginateCommand<>(
                RequestData.external("10.0.0.1"),
                new RecordPagination(null, null, 5, null, null, RecordStatus.SUBMITTED))
            .execute(sessions.scope());

    assertThat(page.links().first()).contains("status=APPROVED&limit=5");
  }

  @Test
  void helpersMayFilterBySubmittedStatus() {
    when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Integer.class)))
        .thenReturn(List.of());
    final ArgumentCaptor<SqlParameterSource> params =
        ArgumentCaptor.forClass(SqlParameterSource.class);

    new PaginateCommand<>(
            RequestData.external("10.0.0.1")
                .withUser(TestSessions.user(1, "helper", PermissionSet.of(Permission.LIST_HELPER))),
            new RecordPagination(null, null, null, null, null, RecordStatus.SUBMITTED))
        .execute(sessions.scope());

    verify(jdbc).queryForList(anyString(), params.capture(), eq(Integer.class));
    assertThat(params.getValue().getValue("status")).isEqualTo("SUBMITTED");
  }

  @Test
  void listingUsersRequiresModerator() {
    final RequestData data =
        RequestData.external("10.0.0.1")
            .withUser(TestSessions.user(1, "helper", PermissionSet.of(Permission.LIST_HELPER)));

    assertThatThrownBy(
            () ->
                new PaginateCommand<>(data, new UserPagination(null, null, null, null, null, null))
                    .execute(sessions.scope()))
        .isInstanceOf(MissingPermissionsException.class);
    verifyNoInteractions(jdbc);
  }

  @Test
  void commandIsNamedAfterTheModel() {
    assertThat(
            new PaginateCommand<>(
                    RequestData.internal(), new PlayerPagination(null, null, null, null, null))
                .name())
        .isEqualTo("PaginatePlayer");
  }

  private Page<PlayerRecord> players(PlayerPagination pagination) {
    return new PaginateCommand<>(RequestData.internal(), pagination).execute(sessions.scope());
  }
}
