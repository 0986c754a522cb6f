package com.prestige.store.notification;

import java.time.Duration;

/** 待機処理の差し替え口。本番は Thread.sleep、テストは記録用の実装を使う。 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> {
      final long millis = duration.toMillis();
      if (millis > 0) {
        Thread.sleep(millis);
      }
    };
  }
}
