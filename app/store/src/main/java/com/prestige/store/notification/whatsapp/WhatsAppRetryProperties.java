package com.prestige.store.notification.whatsapp;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.whatsapp.retry")
public record WhatsAppRetryProperties(
    int maxAttempts, Duration backoffBase, double backoffExponentBase) {

  public WhatsAppRetryProperties {
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofSeconds(1) : backoffBase;
    backoffExponentBase = backoffExponentBase <= 0 ? 2.0 : backoffExponentBase;
  }
}
