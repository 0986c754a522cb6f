package com.prestige.store.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SettingsResponse(Map<String, Setting> settings) {

  public SettingsResponse {
    settings = settings == null ? Map.of() : settings;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Setting(String value, String description, Instant updatedAt) {}

  public record Updated(List<String> updated) {

    public Updated {
      updated = updated == null ? List.of() : List.copyOf(updated);
    }
  }
}
