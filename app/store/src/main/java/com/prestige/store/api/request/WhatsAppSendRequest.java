package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WhatsAppSendRequest(
    @NotBlank(message = "to is required") String to,
    @NotBlank(message = "message is required")
        @Size(max = 4096, message = "message is too long")
        String message,
    String mediaUrl) {}
