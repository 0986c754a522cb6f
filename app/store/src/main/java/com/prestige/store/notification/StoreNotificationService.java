/*
 * どこで: 通知送信のアプリケーションサービス
 * 何を: 問い合わせ・買取申込・見積もりの通知文を組み立て、送信ジョブとしてキューへ積む
 * なぜ: HTTP 応答を送信待ちでブロックせず、プロバイダのレート制限も守るため
 */
package com.prestige.store.notification;

import com.prestige.store.data.Row;
import com.prestige.store.notification.queue.NotificationJob;
import com.prestige.store.notification.queue.OutboundNotificationQueue;
import com.prestige.store.notification.whatsapp.AggregateSendException;
import com.prestige.store.notification.whatsapp.SendResult;
import com.prestige.store.notification.whatsapp.WhatsAppProperties;
import com.prestige.store.notification.whatsapp.WhatsAppRetrySender;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StoreNotificationService {

  private static final Logger logger = LoggerFactory.getLogger(StoreNotificationService.class);

  private final OutboundNotificationQueue queue;
  private final WhatsAppRetrySender retrySender;
  private final WhatsAppProperties properties;

  public void notifyInquiry(long inquiryId, Row inquiry, @Nullable Row watch) {
    enqueueToBusiness("inquiry:" + inquiryId, NotificationMessages.inquiry(inquiry, watch));
  }

  public void notifySellSubmission(long submissionId, Row submission) {
    enqueueToBusiness(
        "sell_submission:" + submissionId, NotificationMessages.sellSubmission(submission));
  }

  public void notifyQuote(long submissionId, Row submission, long quote, @Nullable String notes) {
    enqueueToBusiness("quote:" + submissionId, NotificationMessages.quote(submission, quote, notes));
  }

  /** 顧客への返信をキュー経由で送る。 */
  public void queueReply(String to, String message, String description) {
    queue.enqueue(NotificationJob.named(description, () -> retrySender.sendWithRetry(to, message)));
  }

  /** 管理画面からの単発送信。呼び出し元で結果を返すため同期で送る。 */
  public SendResult sendDirect(String to, String message, @Nullable String mediaUrl) {
    return retrySender.sendWithRetry(to, message, mediaUrl);
  }

  /** 宛先ごとに同期送信し、失敗しても残りの宛先は続行する。 */
  public List<BulkSendResult> sendBulk(List<BulkRecipient> recipients, String defaultMessage) {
    final List<BulkSendResult> results = new ArrayList<>(recipients.size());
    for (BulkRecipient recipient : recipients) {
      final String message = resolveBulkMessage(recipient, defaultMessage);
      try {
        final SendResult result = retrySender.sendWithRetry(recipient.phone(), message);
        results.add(BulkSendResult.sent(recipient.phone(), result.messageId()));
      } catch (AggregateSendException | IllegalArgumentException ex) {
        logger.warn("whatsapp bulk send failed phone={} message={}", recipient.phone(), ex.getMessage());
        results.add(BulkSendResult.failed(recipient.phone(), ex.getMessage()));
      }
    }
    return results;
  }

  private String resolveBulkMessage(BulkRecipient recipient, String defaultMessage) {
    if (recipient.customMessage() != null && !recipient.customMessage().isBlank()) {
      return recipient.customMessage();
    }
    final String name = recipient.name() == null ? "" : recipient.name();
    return defaultMessage.replace("{name}", name);
  }

  private void enqueueToBusiness(String description, String message) {
    final String to = properties.businessNumber();
    queue.enqueue(NotificationJob.named(description, () -> retrySender.sendWithRetry(to, message)));
    logger.info("notification queued job={} pending={}", description, queue.pendingCount());
  }
}
