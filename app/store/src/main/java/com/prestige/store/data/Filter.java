/*
 * どこで: データアクセス層
 * 何を: 列・演算子・値の組で WHERE / ORDER BY / LIMIT を表す不変フィルタ
 * なぜ: 呼び出し側に生の SQL 断片を書かせず、値は常にバインドパラメータで渡すため
 */
package com.prestige.store.data;

import com.prestige.common.JdbcTimestampUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

public final class Filter {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
  private static final Filter ALL = new Filter(List.of(), null, Direction.ASC, null, null);

  public enum Operator {
    EQ("="),
    NE("<>"),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ_IGNORE_CASE("="),
    CONTAINS_IGNORE_CASE("LIKE"),
    IN("IN"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String sql;

    Operator(String sql) {
      this.sql = sql;
    }

    boolean takesValue() {
      return this != IS_NULL && this != IS_NOT_NULL;
    }
  }

  public enum Direction {
    ASC,
    DESC
  }

  /** WHERE を構成する 1 要素。単一条件か、条件の OR グループ。 */
  public interface Criterion {}

  public record Condition(String column, Operator operator, Object value) implements Criterion {
    public Condition {
      requireIdentifier(column);
      Objects.requireNonNull(operator, "operator");
      if (operator.takesValue() && value == null) {
        throw new IllegalArgumentException("value is required for operator " + operator);
      }
      if (operator == Operator.IN && !(value instanceof Collection<?>)) {
        throw new IllegalArgumentException("IN requires a collection value");
      }
    }
  }

  public record AnyOf(List<Condition> conditions) implements Criterion {
    public AnyOf {
      if (conditions == null || conditions.isEmpty()) {
        throw new IllegalArgumentException("anyOf requires at least one condition");
      }
      conditions = List.copyOf(conditions);
    }
  }

  private final List<Criterion> criteria;
  private final String orderColumn;
  private final Direction direction;
  private final Integer limit;
  private final Integer offset;

  private Filter(
      List<Criterion> criteria,
      String orderColumn,
      Direction direction,
      Integer limit,
      Integer offset) {
    this.criteria = List.copyOf(criteria);
    this.orderColumn = orderColumn;
    this.direction = direction;
    this.limit = limit;
    this.offset = offset;
  }

  public static Filter all() {
    return ALL;
  }

  public static Filter where(String column, Object value) {
    return ALL.and(column, Operator.EQ, value);
  }

  public static Filter where(String column, Operator operator, Object value) {
    return ALL.and(column, operator, value);
  }

  public static Condition condition(String column, Operator operator, Object value) {
    return new Condition(column, operator, value);
  }

  public Filter and(String column, Object value) {
    return and(column, Operator.EQ, value);
  }

  public Filter and(String column, Operator operator, Object value) {
    return with(new Condition(column, operator, value));
  }

  public Filter anyOf(Condition... conditions) {
    return with(new AnyOf(List.of(conditions)));
  }

  public Filter orderBy(String column, Direction direction) {
    requireIdentifier(column);
    return new Filter(criteria, column, Objects.requireNonNull(direction), limit, offset);
  }

  public Filter limit(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return new Filter(criteria, orderColumn, direction, limit, offset);
  }

  public Filter offset(int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    return new Filter(criteria, orderColumn, direction, limit, offset);
  }

  /** ページングと並び順を外した条件部分だけのフィルタ。件数取得に使う。 */
  public Filter criteriaOnly() {
    return new Filter(criteria, null, Direction.ASC, null, null);
  }

  public boolean hasCriteria() {
    return !criteria.isEmpty();
  }

  public List<Criterion> criteria() {
    return criteria;
  }

  private Filter with(Criterion criterion) {
    final List<Criterion> next = new ArrayList<>(criteria);
    next.add(criterion);
    return new Filter(next, orderColumn, direction, limit, offset);
  }

  String renderWhere(MapSqlParameterSource params) {
    if (criteria.isEmpty()) {
      return "";
    }
    final List<String> parts = new ArrayList<>();
    for (Criterion criterion : criteria) {
      if (criterion instanceof Condition condition) {
        parts.add(renderCondition(condition, params));
      } else if (criterion instanceof AnyOf anyOf) {
        final List<String> alternatives = new ArrayList<>();
        for (Condition condition : anyOf.conditions()) {
          alternatives.add(renderCondition(condition, params));
        }
        parts.add("(" + String.join(" OR ", alternatives) + ")");
      }
    }
    return " WHERE " + String.join(" AND ", parts);
  }

  String renderPaging(MapSqlParameterSource params) {
    final StringBuilder sql = new StringBuilder();
    if (orderColumn != null) {
      sql.append(" ORDER BY ").append(orderColumn).append(' ').append(direction.name());
    }
    if (limit != null) {
      params.addValue("limit", limit);
      sql.append(" LIMIT :limit");
    }
    if (offset != null) {
      params.addValue("offset", offset);
      sql.append(" OFFSET :offset");
    }
    return sql.toString();
  }

  private String renderCondition(Condition condition, MapSqlParameterSource params) {
    final String column = condition.column();
    final Operator operator = condition.operator();
    if (!operator.takesValue()) {
      return column + " " + operator.sql;
    }
    final String name = "p" + params.getParameterNames().length;
    switch (operator) {
      case EQ_IGNORE_CASE:
        params.addValue(name, condition.value().toString().toLowerCase(Locale.ROOT));
        return "LOWER(" + column + ") = :" + name;
      case CONTAINS_IGNORE_CASE:
        params.addValue(name, "%" + escapeLike(condition.value().toString()) + "%");
        return "LOWER(" + column + ") LIKE :" + name + " ESCAPE '\\'";
      case IN:
        final Collection<?> values = (Collection<?>) condition.value();
        if (values.isEmpty()) {
          // 空の IN は何にも一致しない
          return "1 = 0";
        }
        final List<Object> bound = new ArrayList<>(values.size());
        for (Object value : values) {
          bound.add(bindValue(value));
        }
        params.addValue(name, bound);
        return column + " IN (:" + name + ")";
      default:
        params.addValue(name, bindValue(condition.value()));
        return column + " " + operator.sql + " :" + name;
    }
  }

  static Object bindValue(Object value) {
    if (value instanceof Instant instant) {
      return JdbcTimestampUtils.toTimestamp(instant);
    }
    if (value instanceof Enum<?> constant) {
      return constant.name().toLowerCase(Locale.ROOT);
    }
    return value;
  }

  static String requireIdentifier(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid identifier: " + name);
    }
    return name;
  }

  private static String escapeLike(String raw) {
    return raw.toLowerCase(Locale.ROOT)
        .replace("\\", "\\\\")
        .replace("%", "\\%")
        .replace("_", "\\_");
  }

  @Override
  public String toString() {
    return "Filter{criteria="
        + criteria
        + ", orderBy="
        + orderColumn
        + " "
        + direction
        + ", limit="
        + limit
        + ", offset="
        + offset
        + "}";
  }
}
