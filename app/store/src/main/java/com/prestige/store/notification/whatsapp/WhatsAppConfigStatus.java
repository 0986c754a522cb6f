package com.prestige.store.notification.whatsapp;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WhatsAppConfigStatus(
    String provider,
    String activeProvider,
    String businessNumber,
    boolean configured,
    List<String> issues,
    Map<String, Boolean> supportedFeatures) {

  public WhatsAppConfigStatus {
    issues = issues == null ? List.of() : List.copyOf(issues);
    supportedFeatures = supportedFeatures == null ? Map.of() : Map.copyOf(supportedFeatures);
  }
}
