package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WatchCreateRequest(
    @NotBlank(message = "brand is required") @Size(max = 100, message = "brand is too long")
        String brand,
    @NotBlank(message = "model is required") @Size(max = 100, message = "model is too long")
        String model,
    @NotBlank(message = "reference is required")
        @Size(max = 50, message = "reference is too long")
        String reference,
    @Min(value = 1900, message = "production_year is out of range")
        @Max(value = 2100, message = "production_year is out of range")
        Integer productionYear,
    @NotBlank(message = "condition is required")
        @Size(max = 50, message = "condition is too long")
        String condition,
    @NotNull(message = "price is required") @PositiveOrZero(message = "price must not be negative")
        Long price,
    @PositiveOrZero(message = "market_price must not be negative") Long marketPrice,
    @Size(max = 2000, message = "description is too long") String description,
    @Size(max = 16, message = "image is too long") String image,
    @Size(max = 500, message = "image_url is too long") String imageUrl,
    @Size(max = 500, message = "accessories is too long") String accessories,
    String status) {}
