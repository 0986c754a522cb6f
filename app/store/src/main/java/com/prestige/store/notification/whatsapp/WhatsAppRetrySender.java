/*
 * どこで: WhatsApp 送信のリトライ層
 * 何を: 送信を最大 N 回試み、失敗のたびに指数的に待機時間を延ばす
 * なぜ: 一時的なプロバイダ障害で通知を落とさないため
 */
package com.prestige.store.notification.whatsapp;

import com.google.common.annotations.VisibleForTesting;
import com.prestige.store.notification.NotificationMetrics;
import com.prestige.store.notification.Sleeper;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * 送信プリミティブを包むリトライ付き送信。
 *
 * <p>キューとは独立しており、直接呼んだ場合はキューの送信間隔の制約を受けない。レート制限を守りたい呼び出し元は
 * この呼び出しを NotificationJob に包んで OutboundNotificationQueue へ積む。
 */
@Service
@RequiredArgsConstructor
public class WhatsAppRetrySender {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppRetrySender.class);

  private final WhatsAppSender sender;
  private final WhatsAppRetryProperties properties;
  private final Sleeper sleeper;
  private final NotificationMetrics metrics;

  public SendResult sendWithRetry(String to, String body) {
    return sendWithRetry(to, body, properties.maxAttempts(), null);
  }

  public SendResult sendWithRetry(String to, String body, @Nullable String mediaUrl) {
    return sendWithRetry(to, body, properties.maxAttempts(), mediaUrl);
  }

  public SendResult sendWithRetry(String to, String body, int maxAttempts) {
    return sendWithRetry(to, body, maxAttempts, null);
  }

  /**
   * @throws AggregateSendException 全ての試行が失敗した場合。最後の失敗を原因に持つ
   */
  public SendResult sendWithRetry(
      String to, String body, int maxAttempts, @Nullable String mediaUrl) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    final String provider = sender.provider().id();
    SendException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        final SendResult result = sender.send(to, body, mediaUrl);
        metrics.recordSendAttempt(provider, "succeeded");
        if (attempt > 1) {
          logger.info(
              "whatsapp send succeeded after retry provider={} attempt={}", provider, attempt);
        }
        return result;
      } catch (SendException ex) {
        lastError = ex;
        metrics.recordSendAttempt(provider, "failed");
        logger.warn(
            "whatsapp send attempt failed provider={} attempt={} maxAttempts={} reason={} message={}",
            provider,
            attempt,
            maxAttempts,
            ex.reason(),
            ex.getMessage());
        if (attempt < maxAttempts) {
          waitBeforeRetry(attempt, lastError);
        }
      }
    }
    metrics.recordSendExhausted();
    throw new AggregateSendException(maxAttempts, lastError);
  }

  /** 失敗した attempt 回目の後の待機時間。base * exponentBase^attempt。 */
  @VisibleForTesting
  Duration computeBackoff(int attempt) {
    final double millis =
        properties.backoffBase().toMillis() * Math.pow(properties.backoffExponentBase(), attempt);
    return Duration.ofMillis((long) Math.ceil(millis));
  }

  private void waitBeforeRetry(int attempt, SendException lastError) {
    final Duration backoff = computeBackoff(attempt);
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      // 待機を中断されたらそこで打ち切り、直前の失敗を返す
      metrics.recordSendExhausted();
      throw new AggregateSendException(attempt, lastError);
    }
  }
}
