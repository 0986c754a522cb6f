/*
 * どこで: 通知送信の直列化キュー
 * 何を: 積まれたジョブを FIFO で 1 件ずつ実行し、各ジョブの後に一定時間待機する
 * なぜ: 外部メッセージング API を設定間隔より高い頻度で呼ばないようにするため
 */
package com.prestige.store.notification.queue;

import com.google.common.annotations.VisibleForTesting;
import com.prestige.common.TraceIds;
import com.prestige.store.notification.NotificationMetrics;
import com.prestige.store.notification.Sleeper;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 送信ジョブを直列に処理するキュー。
 *
 * <p>enqueue はどのスレッドからでも呼べて、呼び出し元をブロックしない。ジョブの実行は drain ループだけが行い、
 * 2 つのジョブが重なって動くことはない。失敗したジョブはログとメトリクスに残して破棄し、再投入しない。
 */
public class OutboundNotificationQueue implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(OutboundNotificationQueue.class);

  private final Object lock = new Object();
  private final Deque<NotificationJob> pending = new ArrayDeque<>();
  private final ExecutorService executor;
  private final Sleeper sleeper;
  private final Duration interval;
  private final NotificationMetrics metrics;

  // lock で保護
  private boolean draining;

  public OutboundNotificationQueue(
      ExecutorService executor, Sleeper sleeper, Duration interval, NotificationMetrics metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public void enqueue(NotificationJob job) {
    Objects.requireNonNull(job, "job");
    final boolean startDrain;
    final int size;
    synchronized (lock) {
      pending.addLast(job);
      size = pending.size();
      startDrain = !draining;
      if (startDrain) {
        draining = true;
      }
      // ゲージは lock 内で更新し、drain 側の値と順序を揃える
      metrics.updateQueuePending(size);
    }
    logger.debug("notification job enqueued job={} pending={}", job.description(), size);
    if (startDrain) {
      startDrainLoop();
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  public boolean isDraining() {
    synchronized (lock) {
      return draining;
    }
  }

  public Duration interval() {
    return interval;
  }

  private void startDrainLoop() {
    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException ex) {
      // 停止処理中。ジョブは残し、次の enqueue で再開する
      synchronized (lock) {
        draining = false;
      }
      logger.warn("notification queue drain rejected pending={}", pendingCount(), ex);
    }
  }

  @VisibleForTesting
  void drain() {
    boolean exitedNormally = false;
    try {
      while (true) {
        final NotificationJob job;
        final int remaining;
        synchronized (lock) {
          job = pending.pollFirst();
          if (job == null) {
            draining = false;
            exitedNormally = true;
            return;
          }
          remaining = pending.size();
          metrics.updateQueuePending(remaining);
        }
        runJob(job, remaining);
        if (!pause()) {
          exitedNormally = true;
          return;
        }
      }
    } finally {
      if (!exitedNormally) {
        synchronized (lock) {
          draining = false;
        }
      }
    }
  }

  private void runJob(NotificationJob job, int remaining) {
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      job.run();
      metrics.recordJobResult("succeeded");
      logger.debug("notification job completed job={} pending={}", job.description(), remaining);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.recordJobResult("failed");
      logger.warn("notification job interrupted job={} pending={}", job.description(), remaining, ex);
    } catch (Exception ex) {
      metrics.recordJobResult("failed");
      logger.warn("notification job failed job={} pending={}", job.description(), remaining, ex);
    } finally {
      MDC.remove("trace_id");
    }
  }

  /** ジョブ間の待機。割り込まれたら false を返し、ループを抜ける。 */
  private boolean pause() {
    if (Thread.currentThread().isInterrupted()) {
      return stopOnInterrupt();
    }
    if (interval.isZero()) {
      return true;
    }
    try {
      sleeper.sleep(interval);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return stopOnInterrupt();
    }
  }

  private boolean stopOnInterrupt() {
    final int remaining;
    synchronized (lock) {
      draining = false;
      remaining = pending.size();
    }
    logger.warn("notification queue interrupted pending={}", remaining);
    return false;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    final int remaining = pendingCount();
    if (remaining > 0) {
      logger.warn("notification queue closed with pending jobs pending={}", remaining);
    }
  }
}
