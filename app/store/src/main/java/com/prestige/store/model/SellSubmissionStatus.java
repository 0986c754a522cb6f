package com.prestige.store.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SellSubmissionStatus {
  PENDING,
  QUOTED,
  ACCEPTED,
  COMPLETED,
  REJECTED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SellSubmissionStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    for (SellSubmissionStatus candidate : values()) {
      if (candidate.value().equalsIgnoreCase(value.trim())) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("status is invalid: " + value);
  }
}
