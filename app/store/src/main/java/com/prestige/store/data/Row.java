/*
 * どこで: データアクセス層
 * 何を: 1 行分の列名 -> スカラ値を挿入順で保持する
 * なぜ: テーブル非依存の CRUD で型付きエンティティを持たずに値を受け渡すため
 */
package com.prestige.store.data;

import com.fasterxml.jackson.annotation.JsonValue;
import com.prestige.common.JdbcTimestampUtils;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class Row {

  private final LinkedHashMap<String, Object> values;

  public Row() {
    this.values = new LinkedHashMap<>();
  }

  public Row(Map<String, ?> source) {
    this.values = new LinkedHashMap<>(source);
  }

  public static Row of(String column, Object value) {
    return new Row().put(column, value);
  }

  public Row put(String column, Object value) {
    Objects.requireNonNull(column, "column");
    values.put(column, value);
    return this;
  }

  /** null の値は積まない。部分更新で「指定なし」と「null へ更新」を区別したいときは put を使う。 */
  public Row putIfNotNull(String column, Object value) {
    if (value != null) {
      put(column, value);
    }
    return this;
  }

  public Row remove(String column) {
    values.remove(column);
    return this;
  }

  public boolean has(String column) {
    return values.containsKey(column);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  public Set<String> columns() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public Object get(String column) {
    return values.get(column);
  }

  public String getString(String column) {
    final Object value = values.get(column);
    return value == null ? null : value.toString();
  }

  public Long getLong(String column) {
    final Object value = values.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Long.valueOf(value.toString());
  }

  public Integer getInteger(String column) {
    final Long value = getLong(column);
    return value == null ? null : Math.toIntExact(value);
  }

  public Double getDouble(String column) {
    final Object value = values.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    return Double.valueOf(value.toString());
  }

  public Boolean getBoolean(String column) {
    final Object value = values.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    return Boolean.valueOf(value.toString());
  }

  public Instant getInstant(String column) {
    final Object value = values.get(column);
    if (value == null) {
      return null;
    }
    final Instant instant = JdbcTimestampUtils.toInstant(value);
    if (instant == null) {
      throw new IllegalStateException("column " + column + " is not a timestamp");
    }
    return instant;
  }

  @JsonValue
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Row row)) {
      return false;
    }
    return values.equals(row.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
