package com.prestige.store.notification.queue;

import com.prestige.store.notification.NotificationMetrics;
import com.prestige.store.notification.Sleeper;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(NotificationQueueProperties.class)
public class NotificationQueueConfig {

  @Bean
  Sleeper sleeper() {
    return Sleeper.system();
  }

  @Bean
  OutboundNotificationQueue outboundNotificationQueue(
      NotificationQueueProperties properties, Sleeper sleeper, NotificationMetrics metrics) {
    // drain ループ専用。ジョブ実行はこの 1 スレッドに閉じる
    final ExecutorService executor =
        Executors.newSingleThreadExecutor(daemonThreads(properties.threadName()));
    return new OutboundNotificationQueue(executor, sleeper, properties.interval(), metrics);
  }

  private static ThreadFactory daemonThreads(String name) {
    final AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable, name + "-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
