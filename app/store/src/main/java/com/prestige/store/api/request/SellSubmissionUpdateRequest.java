package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SellSubmissionUpdateRequest(
    String status,
    @PositiveOrZero(message = "estimated_value must not be negative") Long estimatedValue,
    @Size(max = 2000, message = "notes is too long") String notes) {}
