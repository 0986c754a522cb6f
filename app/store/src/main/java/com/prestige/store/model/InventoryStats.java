package com.prestige.store.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InventoryStats(
    Overview overview,
    List<BrandBreakdown> brandBreakdown,
    List<ConditionBreakdown> conditionBreakdown,
    List<Activity> recentActivity) {

  public InventoryStats {
    brandBreakdown = List.copyOf(brandBreakdown);
    conditionBreakdown = List.copyOf(conditionBreakdown);
    recentActivity = List.copyOf(recentActivity);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Overview(long totalWatches, long totalValue, long avgPrice, long recentInquiries) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record BrandBreakdown(String brand, long count, long avgPrice, long totalValue) {}

  public record ConditionBreakdown(String condition, long count) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Activity(String type, String description, Instant createdAt) {}
}
