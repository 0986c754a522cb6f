package com.prestige.store.notification.queue;

import static org.assertj.core.api.Assertions.assertThat;

import com.prestige.store.notification.NotificationMetrics;
import com.prestige.store.notification.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class NotificationQueueConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(NotificationQueueConfig.class)
          .withBean(
              NotificationMetrics.class, () -> new NotificationMetrics(new SimpleMeterRegistry()));

  @Test
  void registersSingleSleeperAndQueueWithDefaultInterval() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(Sleeper.class);
          assertThat(context).hasSingleBean(OutboundNotificationQueue.class);
          assertThat(context.getBean(OutboundNotificationQueue.class).interval())
              .isEqualTo(Duration.ofSeconds(1));
        });
  }

  @Test
  void bindsConfiguredInterval() {
    contextRunner
        .withPropertyValues("store.notification.queue.interval=250ms")
        .run(
            context ->
                assertThat(context.getBean(OutboundNotificationQueue.class).interval())
                    .isEqualTo(Duration.ofMillis(250)));
  }
}
