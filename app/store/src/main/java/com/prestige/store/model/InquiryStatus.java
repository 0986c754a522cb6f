package com.prestige.store.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InquiryStatus {
  PENDING,
  RESPONDED,
  COMPLETED,
  CLOSED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static InquiryStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    for (InquiryStatus candidate : values()) {
      if (candidate.value().equalsIgnoreCase(value.trim())) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("status is invalid: " + value);
  }
}
