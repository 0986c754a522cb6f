package com.prestige.store.api.request;

import jakarta.validation.constraints.Size;

public record InquiryUpdateRequest(
    String status, @Size(max = 2000, message = "notes is too long") String notes) {}
