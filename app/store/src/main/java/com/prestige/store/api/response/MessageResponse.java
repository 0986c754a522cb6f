package com.prestige.store.api.response;

public record MessageResponse(String message) {}
