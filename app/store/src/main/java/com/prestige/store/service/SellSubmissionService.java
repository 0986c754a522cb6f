/*
 * どこで: 買取申込のサービス層
 * 何を: 顧客からの買取申込受付と、管理者による一覧/査定更新を行う
 * なぜ: 受付と見積もり確定のたびに管理者へ WhatsApp 通知を積むため
 */
package com.prestige.store.service;

import com.prestige.store.api.request.SellSubmissionCreateRequest;
import com.prestige.store.api.request.SellSubmissionUpdateRequest;
import com.prestige.store.api.response.PagedRowsResponse;
import com.prestige.store.data.Filter;
import com.prestige.store.data.Row;
import com.prestige.store.data.TableGateway;
import com.prestige.store.model.SellSubmissionStatus;
import com.prestige.store.model.StoreTables;
import com.prestige.store.notification.StoreNotificationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SellSubmissionService {

  private static final Logger logger = LoggerFactory.getLogger(SellSubmissionService.class);

  private final TableGateway tableGateway;
  private final StoreNotificationService notificationService;

  public Row create(SellSubmissionCreateRequest request) {
    final Row row =
        new Row()
            .put("brand", request.brand().trim())
            .put("model", request.model().trim())
            .putIfNotNull("reference", request.reference())
            .putIfNotNull("production_year", request.productionYear())
            .put("condition", request.condition().trim())
            .putIfNotNull("accessories", request.accessories())
            .putIfNotNull("description", request.description())
            .put("customer_name", request.customerName().trim())
            .put("customer_email", request.customerEmail().trim())
            .put("customer_phone", request.customerPhone().trim())
            .put("status", SellSubmissionStatus.PENDING.value());
    final long id = tableGateway.insert(StoreTables.SELL_SUBMISSIONS, row);
    final Row stored = get(id);
    logger.info("sell submission received id={} brand={}", id, request.brand());
    try {
      notificationService.notifySellSubmission(id, stored);
    } catch (RuntimeException ex) {
      logger.warn("sell submission notification could not be queued id={}", id, ex);
    }
    return stored;
  }

  public PagedRowsResponse list(String status, PageWindow page) {
    Filter filter = Filter.all();
    if (status != null && !status.isBlank()) {
      filter = Filter.where("status", SellSubmissionStatus.fromValue(status).value());
    }
    final long total = tableGateway.count(StoreTables.SELL_SUBMISSIONS, filter);
    final List<Row> rows =
        tableGateway.selectAll(
            StoreTables.SELL_SUBMISSIONS,
            filter
                .orderBy("id", Filter.Direction.DESC)
                .limit(page.limit())
                .offset(page.offset()));
    return new PagedRowsResponse(
        rows, PagedRowsResponse.Pagination.of(total, page.limit(), page.offset(), rows.size()));
  }

  public Row get(long id) {
    return tableGateway
        .selectOne(StoreTables.SELL_SUBMISSIONS, Filter.where("id", id))
        .orElseThrow(() -> new ResourceNotFoundException("sell submission not found"));
  }

  /** quoted へ変更し査定額がある場合は、見積もり通知を積む。 */
  public Row update(long id, SellSubmissionUpdateRequest request) {
    get(id);
    SellSubmissionStatus status = null;
    final Row changes =
        new Row()
            .putIfNotNull("estimated_value", request.estimatedValue())
            .putIfNotNull("notes", request.notes());
    if (request.status() != null && !request.status().isBlank()) {
      status = SellSubmissionStatus.fromValue(request.status());
      changes.put("status", status.value());
    }
    tableGateway.update(StoreTables.SELL_SUBMISSIONS, changes, Filter.where("id", id));
    final Row updated = get(id);
    logger.info("sell submission updated id={} columns={}", id, changes.columns());
    if (status == SellSubmissionStatus.QUOTED && request.estimatedValue() != null) {
      try {
        notificationService.notifyQuote(id, updated, request.estimatedValue(), request.notes());
      } catch (RuntimeException ex) {
        logger.warn("quote notification could not be queued id={}", id, ex);
      }
    }
    return updated;
  }
}
