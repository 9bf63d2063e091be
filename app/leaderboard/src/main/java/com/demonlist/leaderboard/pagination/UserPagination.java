package com.demonlist.leaderboard.pagination;

import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.UserRecord;
import com.demonlist.leaderboard.repository.UserRepository;
import org.springframework.jdbc.core.RowMapper;

public class UserPagination extends KeysetPagination<UserRecord> {

  private final String name;
  private final String displayName;
  private final Permission hasPermission;

  public UserPagination(
      Integer after,
      Integer before,
      Integer limit,
      String name,
      String displayName,
      Permission hasPermission) {
    super(after, before, limit);
    this.name = name;
    this.displayName = displayName;
    this.hasPermission = hasPermission;
  }

  @Override
  public String model() {
    return "User";
  }

  @Override
  public PermissionSet requiredPermissions() {
    return PermissionSet.of(Permission.MODERATOR, Permission.ADMINISTRATOR);
  }

  @Override
  protected String source() {
    return UserRepository.SELECT_USER;
  }

  @Override
  protected String idColumn() {
    return "member_id";
  }

  @Override
  protected RowMapper<UserRecord> rowMapper() {
    return UserRepository::mapRow;
  }

  @Override
  protected int idOf(UserRecord row) {
    return row.id();
  }

  @Override
  protected void filters(PageFilters filters) {
    filters
        .equalTo("name", "name", name)
        .equalTo("display_name", "display_name", displayName)
        .add(
            "(s.permissions & :has_permission) <> 0",
            "has_permission",
            hasPermission == null ? null : hasPermission.bit());
  }
}
