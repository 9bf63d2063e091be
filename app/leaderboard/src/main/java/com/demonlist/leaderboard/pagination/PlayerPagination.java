package com.demonlist.leaderboard.pagination;

import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.repository.PlayerRepository;
import org.springframework.jdbc.core.RowMapper;

public class PlayerPagination extends KeysetPagination<PlayerRecord> {

  private final String name;
  private final Boolean banned;

  public PlayerPagination(Integer after, Integer before, Integer limit, String name, Boolean banned) {
    super(after, before, limit);
    this.name = name;
    this.banned = banned;
  }

  @Override
  public String model() {
    return "Player";
  }

  @Override
  protected String source() {
    return PlayerRepository.SELECT_PLAYER;
  }

  @Override
  protected String idColumn() {
    return "id";
  }

  @Override
  protected RowMapper<PlayerRecord> rowMapper() {
    return PlayerRepository::mapRow;
  }

  @Override
  protected int idOf(PlayerRecord row) {
    return row.id();
  }

  @Override
  protected void filters(PageFilters filters) {
    filters.equalToIgnoreCase("name", "name", name).equalTo("banned", "banned", banned);
  }
}
