/*
 * どこで: データアクセス層
 * 何を: テーブル名と Row / Filter から SELECT・INSERT・UPDATE・DELETE を組み立てて実行する
 * なぜ: 各サービスが SQL 文字列を持たずに永続化でき、値のバインドを一箇所に集約するため
 */
package com.prestige.store.data;

import com.prestige.common.JdbcTimestampUtils;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TableGateway {

  static final String ID_COLUMN = "id";
  static final String UPDATED_AT_COLUMN = "updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  public List<Row> selectAll(String table) {
    return selectAll(table, Filter.all());
  }

  public List<Row> selectAll(String table, Filter filter) {
    final String name = Filter.requireIdentifier(table);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        "SELECT * FROM " + name + filter.renderWhere(params) + filter.renderPaging(params);
    return execute(name, "select", () -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  /** 最初に一致した 1 行。0 件は例外ではなく empty。 */
  public Optional<Row> selectOne(String table, Filter filter) {
    return selectAll(table, filter.limit(1)).stream().findFirst();
  }

  public long count(String table, Filter filter) {
    final String name = Filter.requireIdentifier(table);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT COUNT(*) FROM " + name + filter.criteriaOnly().renderWhere(params);
    final Long count =
        execute(name, "count", () -> jdbcTemplate.queryForObject(sql, params, Long.class));
    return count == null ? 0L : count;
  }

  /** 行を挿入し、ストアが採番した id を返す。 */
  public long insert(String table, Row row) {
    final String name = Filter.requireIdentifier(table);
    if (row == null || row.isEmpty()) {
      throw new IllegalArgumentException("row must contain at least one column");
    }
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final List<String> columns = new ArrayList<>();
    final List<String> placeholders = new ArrayList<>();
    for (String column : row.columns()) {
      Filter.requireIdentifier(column);
      columns.add(column);
      placeholders.add(":v_" + column);
      params.addValue("v_" + column, Filter.bindValue(row.get(column)));
    }
    final String sql =
        "INSERT INTO "
            + name
            + " ("
            + String.join(", ", columns)
            + ") VALUES ("
            + String.join(", ", placeholders)
            + ")";
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    execute(
        name,
        "insert",
        () -> jdbcTemplate.update(sql, params, keyHolder, new String[] {ID_COLUMN}));
    return extractId(name, keyHolder);
  }

  /**
   * changes に含まれる列だけを更新し、updated_at を必ず現在時刻で打刻する。
   *
   * @return 1 行以上更新されたか
   */
  public boolean update(String table, Row changes, Filter filter) {
    final String name = Filter.requireIdentifier(table);
    requireCriteria(filter, "update");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final List<String> assignments = new ArrayList<>();
    if (changes != null) {
      for (String column : changes.columns()) {
        Filter.requireIdentifier(column);
        if (UPDATED_AT_COLUMN.equals(column)) {
          continue;
        }
        assignments.add(column + " = :set_" + column);
        params.addValue("set_" + column, Filter.bindValue(changes.get(column)));
      }
    }
    assignments.add(UPDATED_AT_COLUMN + " = :set_" + UPDATED_AT_COLUMN);
    params.addValue(
        "set_" + UPDATED_AT_COLUMN, JdbcTimestampUtils.toTimestamp(Instant.now(clock)));
    final String sql =
        "UPDATE "
            + name
            + " SET "
            + String.join(", ", assignments)
            + filter.renderWhere(params);
    final int updated = execute(name, "update", () -> jdbcTemplate.update(sql, params));
    return updated > 0;
  }

  public boolean delete(String table, Filter filter) {
    final String name = Filter.requireIdentifier(table);
    requireCriteria(filter, "delete");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "DELETE FROM " + name + filter.renderWhere(params);
    final int deleted = execute(name, "delete", () -> jdbcTemplate.update(sql, params));
    return deleted > 0;
  }

  private void requireCriteria(Filter filter, String operation) {
    // 全件 UPDATE / DELETE を誤って発行しない
    if (filter == null || !filter.hasCriteria()) {
      throw new IllegalArgumentException(operation + " requires at least one condition");
    }
  }

  private <T> T execute(String table, String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      final Throwable cause = ex.getMostSpecificCause();
      final String message = cause.getMessage() == null ? ex.getMessage() : cause.getMessage();
      throw new StorageException(table, operation, message, ex);
    }
  }

  private long extractId(String table, KeyHolder keyHolder) {
    final List<Map<String, Object>> keys = keyHolder.getKeyList();
    if (keys.isEmpty()) {
      throw new StorageException(table, "insert", "no generated key returned", null);
    }
    final Map<String, Object> generated = keys.get(0);
    for (Map.Entry<String, Object> entry : generated.entrySet()) {
      if (ID_COLUMN.equalsIgnoreCase(entry.getKey()) && entry.getValue() instanceof Number id) {
        return id.longValue();
      }
    }
    if (generated.size() == 1 && generated.values().iterator().next() instanceof Number id) {
      return id.longValue();
    }
    throw new StorageException(table, "insert", "generated key is not numeric", null);
  }

  private Row mapRow(ResultSet rs, int rowNum) throws SQLException {
    final ResultSetMetaData metaData = rs.getMetaData();
    final Row row = new Row();
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      final String column = metaData.getColumnLabel(i).toLowerCase(Locale.ROOT);
      row.put(column, readValue(rs.getObject(i)));
    }
    return row;
  }

  private Object readValue(Object raw) throws SQLException {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Clob clob) {
      return clob.getSubString(1, (int) clob.length());
    }
    if (JdbcTimestampUtils.isTemporal(raw)) {
      return JdbcTimestampUtils.toInstant(raw);
    }
    return raw;
  }
}
