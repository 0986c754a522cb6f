/*
 * どこで: 通知送信まわり
 * 何を: キュー処理結果・滞留数・WhatsApp 送信試行のメトリクスを記録する
 * なぜ: 通知の取りこぼし (ログのみで破棄される失敗) を Prometheus から観測できるようにするため
 */
package com.prestige.store.notification;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_QUEUE_JOBS = "notification.queue.jobs";
  private static final String METRIC_QUEUE_PENDING = "notification.queue.pending";
  private static final String METRIC_SEND_ATTEMPTS = "whatsapp.send.attempts";
  private static final String METRIC_SEND_EXHAUSTED = "whatsapp.send.exhausted";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queuePending = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter exhaustedCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_PENDING, queuePending, AtomicInteger::get)
        .description("Jobs waiting in the outbound notification queue")
        .register(meterRegistry);
    this.exhaustedCounter =
        Counter.builder(METRIC_SEND_EXHAUSTED)
            .description("WhatsApp sends that failed on every attempt")
            .register(meterRegistry);
  }

  public void recordJobResult(String result) {
    counters
        .computeIfAbsent(
            METRIC_QUEUE_JOBS + ":" + result,
            ignored ->
                Counter.builder(METRIC_QUEUE_JOBS)
                    .description("Outbound notification queue job outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSendAttempt(String provider, String result) {
    counters
        .computeIfAbsent(
            METRIC_SEND_ATTEMPTS + ":" + provider + ":" + result,
            ignored ->
                Counter.builder(METRIC_SEND_ATTEMPTS)
                    .description("WhatsApp provider send attempts")
                    .tags(Tags.of("provider", provider, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSendExhausted() {
    exhaustedCounter.increment();
  }

  public void updateQueuePending(int pending) {
    queuePending.set(Math.max(pending, 0));
  }
}
