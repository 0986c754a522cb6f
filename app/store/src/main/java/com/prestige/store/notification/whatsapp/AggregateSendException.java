package com.prestige.store.notification.whatsapp;

/** リトライ上限まで送信が失敗した。原因には最後の SendException を保持する。 */
public class AggregateSendException extends RuntimeException {

  private final int attempts;

  public AggregateSendException(int attempts, SendException lastError) {
    super(
        "WhatsApp send failed after "
            + attempts
            + " attempts. Last error: "
            + lastError.getMessage(),
        lastError);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  public SendException lastError() {
    return (SendException) getCause();
  }
}
