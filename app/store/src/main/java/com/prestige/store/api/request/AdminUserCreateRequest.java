package com.prestige.store.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AdminUserCreateRequest(
    @NotBlank(message = "username is required")
        @Size(max = 100, message = "username is too long")
        String username,
    @NotBlank(message = "email is required")
        @Email(message = "email is invalid")
        @Size(max = 255, message = "email is too long")
        String email,
    @NotBlank(message = "password is required")
        @Size(min = 8, max = 72, message = "password must be 8 to 72 characters")
        String password,
    String role) {}
