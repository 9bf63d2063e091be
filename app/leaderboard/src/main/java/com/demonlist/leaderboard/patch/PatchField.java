/*
 * どこで: パッチプロトコル
 * 何を: 部分更新の 1 フィールドについて「指定なし」「値を指定」「null を指定」を区別する
 * なぜ: null 許容フィールド(動画 URL など)では「消す」と「触らない」が別の操作になるため
 */
package com.demonlist.leaderboard.patch;

import java.util.Objects;
import java.util.function.Function;

public final class PatchField<T> {

  private static final PatchField<?> ABSENT = new PatchField<>(false, null);

  private final boolean present;
  private final T value;

  private PatchField(boolean present, T value) {
    this.present = present;
    this.value = value;
  }

  @SuppressWarnings("unchecked")
  public static <T> PatchField<T> absent() {
    return (PatchField<T>) ABSENT;
  }

  public static <T> PatchField<T> of(T value) {
    return new PatchField<>(true, Objects.requireNonNull(value, "value"));
  }

  // null 許容フィールド用。null は「値を消す」を意味する
  public static <T> PatchField<T> ofNullable(T value) {
    return new PatchField<>(true, value);
  }

  public boolean isPresent() {
    return present;
  }

  public T value() {
    if (!present) {
      throw new IllegalStateException("patch field is absent");
    }
    return value;
  }

  public T orElse(T fallback) {
    return present ? value : fallback;
  }

  // 値が null の場合は変換せず null のまま保持する
  public <U> PatchField<U> map(Function<? super T, ? extends U> mapper) {
    if (!present) {
      return absent();
    }
    return ofNullable(value == null ? null : mapper.apply(value));
  }

  static <T> PatchField<T> orAbsent(PatchField<T> field) {
    return field == null ? absent() : field;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof PatchField<?> that)) {
      return false;
    }
    return present == that.present && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(present, value);
  }

  @Override
  public String toString() {
    return present ? "PatchField[" + value + "]" : "PatchField.absent";
  }
}
