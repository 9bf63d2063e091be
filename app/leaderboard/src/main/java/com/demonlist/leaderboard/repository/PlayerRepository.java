package com.demonlist.leaderboard.repository;

import com.demonlist.leaderboard.model.PlayerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class PlayerRepository {

  public static final String SELECT_PLAYER =
      """
      SELECT id, name, banned
      FROM players
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<PlayerRecord> findById(int id) {
    final String sql =
        """
        SELECT id, name, banned
        FROM players
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), PlayerRepository::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<PlayerRecord> findByName(String name) {
    final String sql =
        """
        SELECT id, name, banned
        FROM players
        WHERE lower(name) = lower(:name)
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("name", name), PlayerRepository::mapRow)
        .stream()
        .findFirst();
  }

  public boolean existsOtherWithName(String name, int excludingId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM players
        WHERE lower(name) = lower(:name) AND id <> :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("name", name).addValue("id", excludingId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public PlayerRecord insert(String name) {
    final String sql =
        """
        INSERT INTO players (name, banned)
        VALUES (:name, FALSE)
        RETURNING id, name, banned
        """;
    return jdbcTemplate.queryForObject(
        sql, new MapSqlParameterSource().addValue("name", name), PlayerRepository::mapRow);
  }

  public void update(PlayerRecord player) {
    final String sql =
        """
        UPDATE players
        SET name = :name,
            banned = :banned
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", player.id())
            .addValue("name", player.name())
            .addValue("banned", player.banned());
    jdbcTemplate.update(sql, params);
  }

  public static PlayerRecord mapPlayer(ResultSet rs, String prefix) throws SQLException {
    return new PlayerRecord(
        rs.getInt(prefix + "id"), rs.getString(prefix + "name"), rs.getBoolean(prefix + "banned"));
  }

  public static PlayerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return mapPlayer(rs, "");
  }
}
