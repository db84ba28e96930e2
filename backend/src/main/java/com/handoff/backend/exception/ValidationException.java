package com.handoff.backend.exception;

import com.handoff.backend.dto.ApiErrorDetail;

import java.util.List;

/**
 * Malformed note or payload. Carries the offending field, value and constraint so callers can fix the input.
 */
public class ValidationException extends RuntimeException {

    private final List<ApiErrorDetail> details;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<ApiErrorDetail> details) {
        super(message);
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public static ValidationException forField(String field, Object value, String constraint) {
        return new ValidationException(field + ": " + constraint, List.of(ApiErrorDetail.builder()
                .field(field)
                .value(value)
                .issue(constraint)
                .build()));
    }

    public List<ApiErrorDetail> getDetails() {
        return details;
    }
}
