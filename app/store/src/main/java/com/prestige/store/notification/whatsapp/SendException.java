package com.prestige.store.notification.whatsapp;

/** プロバイダへの送信 1 回分の失敗。 */
public class SendException extends RuntimeException {

  public enum Reason {
    REJECTED,
    PROVIDER_ERROR,
    TIMEOUT,
    CONNECTION_FAILED,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final String provider;

  public SendException(String provider, Reason reason, String message) {
    super(message);
    this.provider = provider;
    this.reason = reason;
  }

  public SendException(String provider, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public String provider() {
    return provider;
  }
}
