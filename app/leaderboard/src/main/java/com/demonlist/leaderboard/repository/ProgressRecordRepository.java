package com.demonlist.leaderboard.repository;

import com.demonlist.leaderboard.model.EmbeddedDemon;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.RecordStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class ProgressRecordRepository {

  public static final String SELECT_RECORD =
      """
      SELECT r.id, r.progress, r.video, r.status, r.submitter,
             p.id AS player_id, p.name AS player_name, p.banned AS player_banned,
             d.name AS demon_name, d.position AS demon_position
      FROM records r
      JOIN players p ON p.id = r.player
      JOIN demons d ON d.name = r.demon
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ProgressRecord> findById(int id) {
    final String sql = SELECT_RECORD + "WHERE r.id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), ProgressRecordRepository::mapRow)
        .stream()
        .findFirst();
  }

  // 動画が一致するもの、または同じプレイヤー/デーモンの組を重複とみなす。進捗の高いものを優先する
  public Optional<ProgressRecord> findExisting(int playerId, String demonName, String video) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("player", playerId).addValue("demon", demonName);
    final String sql;
    if (video == null) {
      sql =
          SELECT_RECORD
              + """
              WHERE r.player = :player AND r.demon = :demon
              ORDER BY r.progress DESC, r.id ASC
              LIMIT 1
              """;
    } else {
      sql =
          SELECT_RECORD
              + """
              WHERE r.video = :video OR (r.player = :player AND r.demon = :demon)
              ORDER BY r.progress DESC, r.id ASC
              LIMIT 1
              """;
      params.addValue("video", video);
    }
    return jdbcTemplate.query(sql, params, ProgressRecordRepository::mapRow).stream().findFirst();
  }

  public int insert(int progress, String video, int playerId, int submitterId, String demonName) {
    final String sql =
        """
        INSERT INTO records (progress, video, status, player, submitter, demon)
        VALUES (:progress, :video, 'SUBMITTED', :player, :submitter, :demon)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("progress", progress)
            .addValue("video", video)
            .addValue("player", playerId)
            .addValue("submitter", submitterId)
            .addValue("demon", demonName);
    final Integer id = jdbcTemplate.queryForObject(sql, params, Integer.class);
    if (id == null) {
      throw new IllegalStateException("insert into records returned no id");
    }
    return id;
  }

  public boolean deleteById(int id) {
    return jdbcTemplate.update(
            "DELETE FROM records WHERE id = :id", new MapSqlParameterSource().addValue("id", id))
        > 0;
  }

  public void update(ProgressRecord record) {
    final String sql =
        """
        UPDATE records
        SET progress = :progress,
            video = :video,
            status = :status,
            player = :player,
            demon = :demon
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("progress", record.progress())
            .addValue("video", record.video())
            .addValue("status", record.status().name())
            .addValue("player", record.player().id())
            .addValue("demon", record.demon().name());
    jdbcTemplate.update(sql, params);
  }

  public int deleteSubmittedByPlayer(int playerId) {
    return jdbcTemplate.update(
        "DELETE FROM records WHERE player = :player AND status = 'SUBMITTED'",
        new MapSqlParameterSource().addValue("player", playerId));
  }

  public int rejectAllByPlayer(int playerId) {
    return jdbcTemplate.update(
        "UPDATE records SET status = 'REJECTED' WHERE player = :player",
        new MapSqlParameterSource().addValue("player", playerId));
  }

  public int deleteSubmittedBySubmitter(int submitterId) {
    return jdbcTemplate.update(
        "DELETE FROM records WHERE submitter = :submitter AND status = 'SUBMITTED'",
        new MapSqlParameterSource().addValue("submitter", submitterId));
  }

  public static ProgressRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProgressRecord(
        rs.getInt("id"),
        rs.getInt("progress"),
        rs.getString("video"),
        RecordStatus.valueOf(rs.getString("status")),
        PlayerRepository.mapPlayer(rs, "player_"),
        rs.getInt("submitter"),
        new EmbeddedDemon(rs.getString("demon_name"), rs.getInt("demon_position")));
  }
}
