package com.prestige.store.service;

public record WatchSearchCriteria(
    String query, String brand, Long minPrice, Long maxPrice, String condition) {

  public WatchSearchCriteria {
    if (minPrice != null && maxPrice != null && minPrice > maxPrice) {
      throw new IllegalArgumentException("minPrice must not exceed maxPrice");
    }
  }
}
