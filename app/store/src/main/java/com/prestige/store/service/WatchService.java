/*
 * どこで: 在庫 (時計) のサービス層
 * 何を: 公開カタログの参照・検索と、管理者による登録/更新/論理削除/集計を行う
 * なぜ: 公開側には available の時計だけを見せ、削除しても履歴を残すため
 */
package com.prestige.store.service;

import com.prestige.store.api.request.WatchCreateRequest;
import com.prestige.store.api.request.WatchUpdateRequest;
import com.prestige.store.data.Filter;
import com.prestige.store.data.Row;
import com.prestige.store.data.TableGateway;
import com.prestige.store.model.InventoryStats;
import com.prestige.store.model.StoreTables;
import com.prestige.store.model.WatchStatus;
import com.prestige.store.repository.StoreStatsRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WatchService {

  private static final Logger logger = LoggerFactory.getLogger(WatchService.class);

  static final String DEFAULT_IMAGE = "⌚";
  private static final Duration RECENT_INQUIRY_WINDOW = Duration.ofDays(7);
  private static final Duration ACTIVITY_WINDOW = Duration.ofDays(30);
  private static final int ACTIVITY_LIMIT = 10;

  private final TableGateway tableGateway;
  private final StoreStatsRepository statsRepository;
  private final Clock clock;

  public List<Row> listAvailable() {
    return tableGateway.selectAll(StoreTables.WATCHES, newestFirst(available()));
  }

  public Row getAvailable(long id) {
    return tableGateway
        .selectOne(StoreTables.WATCHES, available().and("id", id))
        .orElseThrow(() -> new ResourceNotFoundException("watch not found"));
  }

  public List<Row> listByBrand(String brand) {
    if (brand == null || brand.isBlank()) {
      throw new IllegalArgumentException("brand is required");
    }
    final Filter filter = available().and("brand", Filter.Operator.EQ_IGNORE_CASE, brand.trim());
    return tableGateway.selectAll(StoreTables.WATCHES, newestFirst(filter));
  }

  public List<Row> search(WatchSearchCriteria criteria) {
    Filter filter = available();
    if (hasText(criteria.query())) {
      final String term = criteria.query().trim();
      filter =
          filter.anyOf(
              Filter.condition("brand", Filter.Operator.CONTAINS_IGNORE_CASE, term),
              Filter.condition("model", Filter.Operator.CONTAINS_IGNORE_CASE, term),
              Filter.condition("reference", Filter.Operator.CONTAINS_IGNORE_CASE, term));
    }
    if (hasText(criteria.brand())) {
      filter = filter.and("brand", Filter.Operator.EQ_IGNORE_CASE, criteria.brand().trim());
    }
    if (criteria.minPrice() != null) {
      filter = filter.and("price", Filter.Operator.GTE, criteria.minPrice());
    }
    if (criteria.maxPrice() != null) {
      filter = filter.and("price", Filter.Operator.LTE, criteria.maxPrice());
    }
    if (hasText(criteria.condition())) {
      filter = filter.and("condition", Filter.Operator.EQ_IGNORE_CASE, criteria.condition().trim());
    }
    return tableGateway.selectAll(StoreTables.WATCHES, newestFirst(filter));
  }

  /** 管理一覧。論理削除済みは含めない。 */
  public List<Row> listForAdmin() {
    final Filter filter =
        Filter.where("status", Filter.Operator.NE, WatchStatus.DELETED.value());
    return tableGateway.selectAll(StoreTables.WATCHES, newestFirst(filter));
  }

  public Row get(long id) {
    return tableGateway
        .selectOne(StoreTables.WATCHES, Filter.where("id", id))
        .orElseThrow(() -> new ResourceNotFoundException("watch not found"));
  }

  public Row create(WatchCreateRequest request) {
    final WatchStatus status =
        hasText(request.status()) ? WatchStatus.fromValue(request.status()) : WatchStatus.AVAILABLE;
    final Row row =
        new Row()
            .put("brand", request.brand().trim())
            .put("model", request.model().trim())
            .put("reference", request.reference().trim())
            .putIfNotNull("production_year", request.productionYear())
            .put("condition", request.condition().trim())
            .put("price", request.price())
            .putIfNotNull("market_price", request.marketPrice())
            .put("description", request.description() == null ? "" : request.description())
            .put("image", hasText(request.image()) ? request.image() : DEFAULT_IMAGE)
            .putIfNotNull("image_url", request.imageUrl())
            .put("accessories", request.accessories() == null ? "" : request.accessories())
            .put("status", status.value());
    final long id = tableGateway.insert(StoreTables.WATCHES, row);
    logger.info("watch created id={} brand={} reference={}", id, request.brand(), request.reference());
    return get(id);
  }

  public Row update(long id, WatchUpdateRequest request) {
    get(id);
    final Row changes =
        new Row()
            .putIfNotNull("brand", trimmed(request.brand()))
            .putIfNotNull("model", trimmed(request.model()))
            .putIfNotNull("reference", trimmed(request.reference()))
            .putIfNotNull("production_year", request.productionYear())
            .putIfNotNull("condition", trimmed(request.condition()))
            .putIfNotNull("price", request.price())
            .putIfNotNull("market_price", request.marketPrice())
            .putIfNotNull("description", request.description())
            .putIfNotNull("image", trimmed(request.image()))
            .putIfNotNull("image_url", request.imageUrl())
            .putIfNotNull("accessories", request.accessories());
    if (hasText(request.status())) {
      changes.put("status", WatchStatus.fromValue(request.status()).value());
    }
    tableGateway.update(StoreTables.WATCHES, changes, Filter.where("id", id));
    logger.info("watch updated id={} columns={}", id, changes.columns());
    return get(id);
  }

  /** 履歴を残すため行は消さず status を deleted にする。 */
  public void delete(long id) {
    get(id);
    tableGateway.update(
        StoreTables.WATCHES,
        Row.of("status", WatchStatus.DELETED.value()),
        Filter.where("id", id));
    logger.info("watch soft-deleted id={}", id);
  }

  public InventoryStats.Overview overview() {
    return statsRepository.inventoryOverview(Instant.now(clock).minus(RECENT_INQUIRY_WINDOW));
  }

  public InventoryStats stats() {
    final Instant now = Instant.now(clock);
    return new InventoryStats(
        overview(),
        statsRepository.brandBreakdown(),
        statsRepository.conditionBreakdown(),
        statsRepository.recentActivity(now.minus(ACTIVITY_WINDOW), ACTIVITY_LIMIT));
  }

  private static Filter available() {
    return Filter.where("status", WatchStatus.AVAILABLE.value());
  }

  private static Filter newestFirst(Filter filter) {
    return filter.orderBy("id", Filter.Direction.DESC);
  }

  private static String trimmed(String value) {
    return value == null ? null : value.trim();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
