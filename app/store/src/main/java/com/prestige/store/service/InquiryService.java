/*
 * どこで: 問い合わせのサービス層
 * 何を: 顧客からの問い合わせ受付と、管理者による一覧/更新/削除/集計を行う
 * なぜ: 受付時に管理者へ WhatsApp 通知を積み、対応漏れを防ぐため
 */
package com.prestige.store.service;

import com.prestige.store.api.request.InquiryCreateRequest;
import com.prestige.store.api.request.InquiryUpdateRequest;
import com.prestige.store.api.response.PagedRowsResponse;
import com.prestige.store.data.Filter;
import com.prestige.store.data.Row;
import com.prestige.store.data.TableGateway;
import com.prestige.store.model.InquiryStats;
import com.prestige.store.model.InquiryStatus;
import com.prestige.store.model.StoreTables;
import com.prestige.store.model.WatchStatus;
import com.prestige.store.notification.StoreNotificationService;
import com.prestige.store.repository.StoreStatsRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InquiryService {

  private static final Logger logger = LoggerFactory.getLogger(InquiryService.class);
  private static final Duration RECENT_WINDOW = Duration.ofDays(7);

  private final TableGateway tableGateway;
  private final StoreStatsRepository statsRepository;
  private final StoreNotificationService notificationService;
  private final Clock clock;

  public Row create(InquiryCreateRequest request) {
    Row watch = null;
    if (request.watchId() != null) {
      watch =
          tableGateway
              .selectOne(
                  StoreTables.WATCHES,
                  Filter.where("id", request.watchId())
                      .and("status", WatchStatus.AVAILABLE.value()))
              .orElseThrow(() -> new IllegalArgumentException("watch is not available"));
    }
    final Row row =
        new Row()
            .putIfNotNull("watch_id", request.watchId())
            .put("customer_name", request.customerName().trim())
            .put("customer_email", request.customerEmail().trim())
            .putIfNotNull("customer_phone", request.customerPhone())
            .put("message", request.message())
            .put("status", InquiryStatus.PENDING.value());
    final long id = tableGateway.insert(StoreTables.INQUIRIES, row);
    final Row stored = get(id);
    logger.info("inquiry received id={} watchId={}", id, request.watchId());
    notifySafely(id, stored, watch);
    return stored;
  }

  public PagedRowsResponse list(String status, PageWindow page) {
    Filter filter = Filter.all();
    if (status != null && !status.isBlank()) {
      filter = Filter.where("status", InquiryStatus.fromValue(status).value());
    }
    final long total = tableGateway.count(StoreTables.INQUIRIES, filter);
    final List<Row> rows =
        tableGateway.selectAll(
            StoreTables.INQUIRIES,
            filter
                .orderBy("id", Filter.Direction.DESC)
                .limit(page.limit())
                .offset(page.offset()));
    return new PagedRowsResponse(
        withWatchDetails(rows),
        PagedRowsResponse.Pagination.of(total, page.limit(), page.offset(), rows.size()));
  }

  public Row get(long id) {
    return tableGateway
        .selectOne(StoreTables.INQUIRIES, Filter.where("id", id))
        .orElseThrow(() -> new ResourceNotFoundException("inquiry not found"));
  }

  public Row update(long id, InquiryUpdateRequest request) {
    get(id);
    final Row changes = new Row().putIfNotNull("notes", request.notes());
    if (request.status() != null && !request.status().isBlank()) {
      changes.put("status", InquiryStatus.fromValue(request.status()).value());
    }
    tableGateway.update(StoreTables.INQUIRIES, changes, Filter.where("id", id));
    logger.info("inquiry updated id={} columns={}", id, changes.columns());
    return get(id);
  }

  public void delete(long id) {
    if (!tableGateway.delete(StoreTables.INQUIRIES, Filter.where("id", id))) {
      throw new ResourceNotFoundException("inquiry not found");
    }
    logger.info("inquiry deleted id={}", id);
  }

  public InquiryStats stats() {
    return statsRepository.inquiryStats(Instant.now(clock).minus(RECENT_WINDOW));
  }

  /** 一覧表示用に watch_brand / watch_model / watch_reference を付与する。 */
  private List<Row> withWatchDetails(List<Row> inquiries) {
    final List<Long> watchIds =
        inquiries.stream()
            .map(row -> row.getLong("watch_id"))
            .filter(Objects::nonNull)
            .distinct()
            .toList();
    if (watchIds.isEmpty()) {
      return inquiries;
    }
    final Map<Long, Row> watches = new HashMap<>();
    for (Row watch :
        tableGateway.selectAll(
            StoreTables.WATCHES, Filter.where("id", Filter.Operator.IN, watchIds))) {
      watches.put(watch.getLong("id"), watch);
    }
    final List<Row> enriched = new ArrayList<>(inquiries.size());
    for (Row inquiry : inquiries) {
      final Row copy = new Row(inquiry.asMap());
      final Row watch = watches.get(inquiry.getLong("watch_id"));
      if (watch != null) {
        copy.put("watch_brand", watch.getString("brand"))
            .put("watch_model", watch.getString("model"))
            .put("watch_reference", watch.getString("reference"));
      }
      enriched.add(copy);
    }
    return enriched;
  }

  private void notifySafely(long id, Row inquiry, Row watch) {
    try {
      notificationService.notifyInquiry(id, inquiry, watch);
    } catch (RuntimeException ex) {
      // 通知の失敗で受付自体は失敗させない
      logger.warn("inquiry notification could not be queued id={}", id, ex);
    }
  }
}
