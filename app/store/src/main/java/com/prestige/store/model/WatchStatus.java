package com.prestige.store.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum WatchStatus {
  AVAILABLE,
  SOLD,
  RESERVED,
  DELETED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static WatchStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    for (WatchStatus candidate : values()) {
      if (candidate.value().equalsIgnoreCase(value.trim())) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("status is invalid: " + value);
  }
}
