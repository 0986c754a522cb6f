/*
 * どこで: 通知キューの設定バインド
 * 何を: ジョブ間の待機時間を保持する
 * なぜ: 送信先 API のレート制限に合わせて運用で調整できるようにするため
 */
package com.prestige.store.notification.queue;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.notification.queue")
public record NotificationQueueProperties(Duration interval, String threadName) {

  public NotificationQueueProperties {
    interval = interval == null ? Duration.ofSeconds(1) : interval;
    if (interval.isNegative()) {
      throw new IllegalArgumentException("store.notification.queue.interval must not be negative");
    }
    threadName =
        threadName == null || threadName.isBlank() ? "notification-queue" : threadName;
  }
}
