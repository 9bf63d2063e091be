package com.demonlist.leaderboard.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

public record PermissionSet(Set<Permission> permissions) {

  private static final PermissionSet EMPTY = new PermissionSet(EnumSet.noneOf(Permission.class));

  public PermissionSet {
    permissions =
        permissions == null || permissions.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(Permission.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(permissions));
  }

  public static PermissionSet empty() {
    return EMPTY;
  }

  public static PermissionSet of(Permission first, Permission... rest) {
    return new PermissionSet(EnumSet.of(first, rest));
  }

  public static PermissionSet of(Collection<Permission> permissions) {
    return new PermissionSet(permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions));
  }

  public static PermissionSet fromBits(int bits) {
    final EnumSet<Permission> set = EnumSet.noneOf(Permission.class);
    for (Permission permission : Permission.values()) {
      if ((bits & permission.bit()) != 0) {
        set.add(permission);
      }
    }
    return new PermissionSet(set);
  }

  public int bits() {
    int bits = 0;
    for (Permission permission : permissions) {
      bits |= permission.bit();
    }
    return bits;
  }

  public boolean isEmpty() {
    return permissions.isEmpty();
  }

  public boolean contains(Permission permission) {
    return permissions.contains(permission);
  }

  // 判定は「いずれか一つを持っていれば良い」。全部を要求するものではない
  public boolean intersects(PermissionSet other) {
    for (Permission permission : other.permissions) {
      if (permissions.contains(permission)) {
        return true;
      }
    }
    return false;
  }

  public PermissionSet union(PermissionSet other) {
    if (other.isEmpty()) {
      return this;
    }
    final EnumSet<Permission> merged = EnumSet.noneOf(Permission.class);
    merged.addAll(permissions);
    merged.addAll(other.permissions);
    return new PermissionSet(merged);
  }

  public PermissionSet implied() {
    final EnumSet<Permission> expanded = EnumSet.noneOf(Permission.class);
    for (Permission permission : permissions) {
      Permission current = permission;
      while (current != null && expanded.add(current)) {
        current = current.implies();
      }
    }
    return new PermissionSet(expanded);
  }

  @Override
  public String toString() {
    return permissions.stream().map(Enum::name).collect(Collectors.joining(" or ", "[", "]"));
  }
}
