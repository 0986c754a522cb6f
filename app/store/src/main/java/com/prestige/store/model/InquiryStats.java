package com.prestige.store.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InquiryStats(long total, Counts inquiries, Counts sellSubmissions) {

  public record Counts(long total, long pending, long recent) {}
}
