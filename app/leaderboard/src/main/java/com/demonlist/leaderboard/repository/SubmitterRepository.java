package com.demonlist.leaderboard.repository;

import com.demonlist.leaderboard.model.SubmitterRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class SubmitterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<SubmitterRecord> findByIp(String ip) {
    final String sql =
        """
        SELECT submitter_id, ip_address, banned
        FROM submitters
        WHERE ip_address = :ip
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("ip", ip), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<SubmitterRecord> findById(int id) {
    final String sql =
        """
        SELECT submitter_id, ip_address, banned
        FROM submitters
        WHERE submitter_id = :id
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public SubmitterRecord insert(String ip) {
    final String sql =
        """
        INSERT INTO submitters (ip_address, banned)
        VALUES (:ip, FALSE)
        RETURNING submitter_id, ip_address, banned
        """;
    return jdbcTemplate.queryForObject(
        sql, new MapSqlParameterSource().addValue("ip", ip), this::mapRow);
  }

  public void updateBanned(int id, boolean banned) {
    final String sql =
        """
        UPDATE submitters
        SET banned = :banned
        WHERE submitter_id = :id
        """;
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("id", id).addValue("banned", banned));
  }

  private SubmitterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubmitterRecord(
        rs.getInt("submitter_id"), rs.getString("ip_address"), rs.getBoolean("banned"));
  }
}
