package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SellSubmissionCreateRequest(
    @NotBlank(message = "brand is required") @Size(max = 100, message = "brand is too long")
        String brand,
    @NotBlank(message = "model is required") @Size(max = 100, message = "model is too long")
        String model,
    @Size(max = 50, message = "reference is too long") String reference,
    @Min(value = 1900, message = "production_year is out of range")
        @Max(value = 2100, message = "production_year is out of range")
        Integer productionYear,
    @NotBlank(message = "condition is required")
        @Size(max = 50, message = "condition is too long")
        String condition,
    @Size(max = 500, message = "accessories is too long") String accessories,
    @Size(max = 2000, message = "description is too long") String description,
    @NotBlank(message = "customer_name is required")
        @Size(max = 100, message = "customer_name is too long")
        String customerName,
    @NotBlank(message = "customer_email is required")
        @Email(message = "customer_email is invalid")
        @Size(max = 255, message = "customer_email is too long")
        String customerEmail,
    @NotBlank(message = "customer_phone is required")
        @Size(max = 20, message = "customer_phone is too long")
        String customerPhone) {}
