package com.prestige.store.notification.queue;

/** キューに積む送信 1 件分の遅延処理。失敗は例外で通知する。 */
@FunctionalInterface
public interface NotificationJob {

  void run() throws Exception;

  default String description() {
    return "notification job";
  }

  static NotificationJob named(String description, NotificationJob body) {
    return new NotificationJob() {
      @Override
      public void run() throws Exception {
        body.run();
      }

      @Override
      public String description() {
        return description;
      }
    };
  }
}
