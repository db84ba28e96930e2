package com.handoff.backend.exception;

public class UnauthorizedException extends RuntimeException {

    private final String reason;

    public UnauthorizedException(String message) {
        this("UNAUTHORIZED", message);
    }

    public UnauthorizedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /** Short machine-readable cause, e.g. {@code INVALID_TOKEN} or {@code SIGNATURE_REPLAYED}. */
    public String getReason() {
        return reason;
    }
}
