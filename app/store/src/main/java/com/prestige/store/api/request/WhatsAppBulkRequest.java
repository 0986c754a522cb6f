package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.prestige.store.notification.BulkRecipient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WhatsAppBulkRequest(
    @NotEmpty(message = "recipients is required")
        @Size(max = 100, message = "recipients must be at most 100")
        List<@Valid BulkRecipient> recipients,
    @NotBlank(message = "default_message is required") String defaultMessage) {}
