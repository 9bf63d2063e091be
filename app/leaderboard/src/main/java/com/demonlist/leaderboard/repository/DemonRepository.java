package com.demonlist.leaderboard.repository;

import com.demonlist.leaderboard.model.DemonRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class DemonRepository {

  private static final String SELECT_DEMON =
      """
      SELECT d.name, d.position, d.requirement, d.video,
             v.id AS verifier_id, v.name AS verifier_name, v.banned AS verifier_banned,
             p.id AS publisher_id, p.name AS publisher_name, p.banned AS publisher_banned
      FROM demons d
      JOIN players v ON v.id = d.verifier
      JOIN players p ON p.id = d.publisher
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DemonRecord> findByName(String name) {
    final String sql = SELECT_DEMON + "WHERE lower(d.name) = lower(:name)";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("name", name), this::mapRow)
        .stream()
        .findFirst();
  }

  public boolean existsOtherWithName(String name, String excludingName) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM demons
        WHERE lower(name) = lower(:name) AND name <> :excluding
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("excluding", excludingName == null ? "" : excludingName);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM demons", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public void insert(DemonRecord demon) {
    final String sql =
        """
        INSERT INTO demons (name, position, requirement, video, verifier, publisher)
        VALUES (:name, :position, :requirement, :video, :verifier, :publisher)
        """;
    jdbcTemplate.update(sql, params(demon));
  }

  // originalName で対象を特定し、改名も含めて全列を書き戻す
  public void update(String originalName, DemonRecord demon) {
    final String sql =
        """
        UPDATE demons
        SET name = :name,
            requirement = :requirement,
            video = :video,
            verifier = :verifier,
            publisher = :publisher
        WHERE name = :originalName
        """;
    jdbcTemplate.update(sql, params(demon).addValue("originalName", originalName));
  }

  // 挿入位置以降のデーモンを 1 つずつ下げる
  public void shiftDownFrom(int position) {
    final String sql =
        """
        UPDATE demons
        SET position = position + 1
        WHERE position >= :position
        """;
    jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("position", position));
  }

  // from -> to へ移動し、間にあるデーモンを詰め直す。呼び出し側のトランザクション内で使うこと
  public void move(String name, int from, int to) {
    if (from == to) {
      return;
    }
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("from", from).addValue("to", to);
    if (to < from) {
      jdbcTemplate.update(
          """
          UPDATE demons
          SET position = position + 1
          WHERE position >= :to AND position < :from
          """,
          params);
    } else {
      jdbcTemplate.update(
          """
          UPDATE demons
          SET position = position - 1
          WHERE position > :from AND position <= :to
          """,
          params);
    }
    jdbcTemplate.update(
        "UPDATE demons SET position = :to WHERE name = :name", params.addValue("name", name));
  }

  private MapSqlParameterSource params(DemonRecord demon) {
    return new MapSqlParameterSource()
        .addValue("name", demon.name())
        .addValue("position", demon.position())
        .addValue("requirement", demon.requirement())
        .addValue("video", demon.video())
        .addValue("verifier", demon.verifier().id())
        .addValue("publisher", demon.publisher().id());
  }

  private DemonRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DemonRecord(
        rs.getString("name"),
        rs.getInt("position"),
        rs.getInt("requirement"),
        rs.getString("video"),
        PlayerRepository.mapPlayer(rs, "verifier_"),
        PlayerRepository.mapPlayer(rs, "publisher_"));
  }
}
