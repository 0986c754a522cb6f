/*
 * どこで: 管理画面の集計
 * 何を: 在庫サマリ・ブランド別/状態別内訳・直近アクティビティを集計する
 * なぜ: GROUP BY や UNION を伴う集計は汎用 CRUD では表現できないため専用 SQL で持つ
 */
package com.prestige.store.repository;

import static com.prestige.common.JdbcTimestampUtils.toTimestamp;

import com.prestige.common.JdbcTimestampUtils;
import com.prestige.store.data.StorageException;
import com.prestige.store.model.InquiryStats;
import com.prestige.store.model.InquiryStatus;
import com.prestige.store.model.InventoryStats;
import com.prestige.store.model.WatchStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StoreStatsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public InventoryStats.Overview inventoryOverview(Instant recentSince) {
    final String sql =
        """
        SELECT
          (SELECT COUNT(*) FROM watches WHERE status = :available) AS total_watches,
          (SELECT COALESCE(SUM(price), 0) FROM watches WHERE status = :available) AS total_value,
          (SELECT COALESCE(AVG(price), 0) FROM watches WHERE status = :available) AS avg_price,
          (SELECT COUNT(*) FROM inquiries WHERE created_at > :since) AS recent_inquiries
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("available", WatchStatus.AVAILABLE.value())
            .addValue("since", toTimestamp(recentSince));
    return execute(
        "watches",
        "inventory_overview",
        () ->
            jdbcTemplate.queryForObject(
                sql,
                params,
                (rs, rowNum) ->
                    new InventoryStats.Overview(
                        rs.getLong("total_watches"),
                        rs.getLong("total_value"),
                        Math.round(rs.getDouble("avg_price")),
                        rs.getLong("recent_inquiries"))));
  }

  public List<InventoryStats.BrandBreakdown> brandBreakdown() {
    final String sql =
        """
        SELECT brand, COUNT(*) AS watch_count, AVG(price) AS avg_price, SUM(price) AS total_value
        FROM watches
        WHERE status = :available
        GROUP BY brand
        ORDER BY watch_count DESC, brand ASC
        """;
    return execute(
        "watches",
        "brand_breakdown",
        () ->
            jdbcTemplate.query(
                sql,
                new MapSqlParameterSource("available", WatchStatus.AVAILABLE.value()),
                (rs, rowNum) ->
                    new InventoryStats.BrandBreakdown(
                        rs.getString("brand"),
                        rs.getLong("watch_count"),
                        Math.round(rs.getDouble("avg_price")),
                        rs.getLong("total_value"))));
  }

  public List<InventoryStats.ConditionBreakdown> conditionBreakdown() {
    final String sql =
        """
        SELECT condition, COUNT(*) AS watch_count
        FROM watches
        WHERE status = :available
        GROUP BY condition
        ORDER BY watch_count DESC, condition ASC
        """;
    return execute(
        "watches",
        "condition_breakdown",
        () ->
            jdbcTemplate.query(
                sql,
                new MapSqlParameterSource("available", WatchStatus.AVAILABLE.value()),
                (rs, rowNum) ->
                    new InventoryStats.ConditionBreakdown(
                        rs.getString("condition"), rs.getLong("watch_count"))));
  }

  public List<InventoryStats.Activity> recentActivity(Instant since, int limit) {
    // 在庫追加と問い合わせを時系列で混ぜて返す
    final String sql =
        """
        SELECT activity_type, description, created_at FROM (
          SELECT 'watch_added' AS activity_type,
                 brand || ' ' || model AS description,
                 created_at
          FROM watches
          WHERE created_at > :since
          UNION ALL
          SELECT 'inquiry' AS activity_type,
                 'Inquiry for ' || COALESCE(w.brand || ' ' || w.model, 'general enquiry') AS description,
                 i.created_at AS created_at
          FROM inquiries i
          LEFT JOIN watches w ON i.watch_id = w.id
          WHERE i.created_at > :since
        ) activity
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("since", toTimestamp(since))
            .addValue("limit", limit);
    return execute(
        "watches", "recent_activity", () -> jdbcTemplate.query(sql, params, this::mapActivity));
  }

  public InquiryStats inquiryStats(Instant recentSince) {
    final String sql =
        """
        SELECT
          (SELECT COUNT(*) FROM inquiries) AS inquiries_total,
          (SELECT COUNT(*) FROM inquiries WHERE status = :pending) AS inquiries_pending,
          (SELECT COUNT(*) FROM inquiries WHERE created_at > :since) AS inquiries_recent,
          (SELECT COUNT(*) FROM sell_submissions) AS sell_total,
          (SELECT COUNT(*) FROM sell_submissions WHERE status = :pending) AS sell_pending,
          (SELECT COUNT(*) FROM sell_submissions WHERE created_at > :since) AS sell_recent
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("pending", InquiryStatus.PENDING.value())
            .addValue("since", toTimestamp(recentSince));
    return execute(
        "inquiries",
        "inquiry_stats",
        () -> jdbcTemplate.queryForObject(sql, params, this::mapInquiryStats));
  }

  private InquiryStats mapInquiryStats(ResultSet rs, int rowNum) throws SQLException {
    final InquiryStats.Counts inquiries =
        new InquiryStats.Counts(
            rs.getLong("inquiries_total"),
            rs.getLong("inquiries_pending"),
            rs.getLong("inquiries_recent"));
    final InquiryStats.Counts sellSubmissions =
        new InquiryStats.Counts(
            rs.getLong("sell_total"), rs.getLong("sell_pending"), rs.getLong("sell_recent"));
    return new InquiryStats(
        inquiries.total() + sellSubmissions.total(), inquiries, sellSubmissions);
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

  private InventoryStats.Activity mapActivity(ResultSet rs, int rowNum) throws SQLException {
    return new InventoryStats.Activity(
        rs.getString("activity_type"),
        rs.getString("description"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")));
  }
}
