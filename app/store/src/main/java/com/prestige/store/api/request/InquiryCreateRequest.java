package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InquiryCreateRequest(
    Long watchId,
    @NotBlank(message = "customer_name is required")
        @Size(max = 100, message = "customer_name is too long")
        String customerName,
    @NotBlank(message = "customer_email is required")
        @Email(message = "customer_email is invalid")
        @Size(max = 255, message = "customer_email is too long")
        String customerEmail,
    @Size(max = 20, message = "customer_phone is too long") String customerPhone,
    @NotBlank(message = "message is required") @Size(max = 2000, message = "message is too long")
        String message) {}
