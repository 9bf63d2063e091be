package com.demonlist.leaderboard.repository;

import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class UserRepository {

  public static final String SELECT_USER =
      """
      SELECT member_id, name, display_name, youtube_channel, permissions, password_hash
      FROM members
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(int id) {
    return jdbcTemplate
        .query(
            SELECT_USER + "WHERE member_id = :id",
            new MapSqlParameterSource().addValue("id", id),
            UserRepository::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<UserRecord> findByName(String name) {
    return jdbcTemplate
        .query(
            SELECT_USER + "WHERE name = :name",
            new MapSqlParameterSource().addValue("name", name),
            UserRepository::mapRow)
        .stream()
        .findFirst();
  }

  public UserRecord insert(String name, String passwordHash) {
    final String sql =
        """
        INSERT INTO members (name, password_hash, permissions)
        VALUES (:name, :passwordHash, 0)
        RETURNING member_id, name, display_name, youtube_channel, permissions, password_hash
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("name", name).addValue("passwordHash", passwordHash);
    return jdbcTemplate.queryForObject(sql, params, UserRepository::mapRow);
  }

  public void update(UserRecord user) {
    final String sql =
        """
        UPDATE members
        SET display_name = :displayName,
            youtube_channel = :youtubeChannel,
            permissions = :permissions,
            password_hash = :passwordHash
        WHERE member_id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", user.id())
            .addValue("displayName", user.displayName())
            .addValue("youtubeChannel", user.youtubeChannel())
            .addValue("permissions", user.permissions().bits())
            .addValue("passwordHash", user.passwordHash());
    jdbcTemplate.update(sql, params);
  }

  // 本人による変更。権限は管理者の変更と競合しないよう書き戻さない
  public void updateProfile(UserRecord user) {
    final String sql =
        """
        UPDATE members
        SET display_name = :displayName,
            youtube_channel = :youtubeChannel,
            password_hash = :passwordHash
        WHERE member_id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", user.id())
            .addValue("displayName", user.displayName())
            .addValue("youtubeChannel", user.youtubeChannel())
            .addValue("passwordHash", user.passwordHash());
    jdbcTemplate.update(sql, params);
  }

  public boolean deleteById(int id) {
    return jdbcTemplate.update(
            "DELETE FROM members WHERE member_id = :id",
            new MapSqlParameterSource().addValue("id", id))
        > 0;
  }

  public static UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getInt("member_id"),
        rs.getString("name"),
        rs.getString("display_name"),
        rs.getString("youtube_channel"),
        PermissionSet.fromBits(rs.getInt("permissions")),
        rs.getString("password_hash"));
  }
}
