package com.demonlist.leaderboard.pagination;

import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.RecordStatus;
import com.demonlist.leaderboard.repository.ProgressRecordRepository;
import org.springframework.jdbc.core.RowMapper;

/**
 * Keyset pagination over records, filterable by player, demon and status.
 *
 * <p>Callers without list-helper rights only ever see APPROVED records. A status filter they
 * pass is replaced by APPROVED rather than rejected, and the navigation links carry the
 * replaced filter so the caller can see what was applied.
 */
public class RecordPagination extends KeysetPagination<ProgressRecord> {

  private final Integer player;
  private final String demon;
  private final RecordStatus status;

  public RecordPagination(
      Integer after, Integer before, Integer limit, Integer player, String demon, RecordStatus status) {
    super(after, before, limit);
    this.player = player;
    this.demon = demon;
    this.status = status;
  }

  public RecordStatus status() {
    return status;
  }

  @Override
  public String model() {
    return "Record";
  }

  @Override
  public KeysetPagination<ProgressRecord> restrictTo(RequestContext ctx) {
    if (ctx.isListHelper() || status == RecordStatus.APPROVED) {
      return this;
    }
    return new RecordPagination(after(), before(), limit(), player, demon, RecordStatus.APPROVED);
  }

  @Override
  protected String source() {
    return ProgressRecordRepository.SELECT_RECORD;
  }

  @Override
  protected String idColumn() {
    return "id";
  }

  @Override
  protected RowMapper<ProgressRecord> rowMapper() {
    return ProgressRecordRepository::mapRow;
  }

  @Override
  protected int idOf(ProgressRecord row) {
    return row.id();
  }

  @Override
  protected void filters(PageFilters filters) {
    filters
        .equalTo("player_id", "player", player)
        .equalTo("demon_name", "demon", demon)
        .equalTo("status", "status", status == null ? null : status.name());
  }
}
