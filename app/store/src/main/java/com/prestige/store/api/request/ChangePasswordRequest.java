package com.prestige.store.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChangePasswordRequest(
    @NotBlank(message = "current_password is required") String currentPassword,
    @NotBlank(message = "new_password is required")
        @Size(min = 8, max = 72, message = "new_password must be 8 to 72 characters")
        String newPassword) {}
