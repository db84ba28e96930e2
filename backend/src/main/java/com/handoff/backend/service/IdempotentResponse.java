package com.handoff.backend.service;

public record IdempotentResponse<T>(T body, int statusCode, boolean replayed) {
}
