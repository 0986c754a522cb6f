package com.prestige.store.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AdminRole {
  ADMIN,
  MANAGER,
  STAFF,
  VIEWER;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AdminRole fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("role is required");
    }
    for (AdminRole candidate : values()) {
      if (candidate.value().equalsIgnoreCase(value.trim())) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("role is invalid: " + value);
  }
}
