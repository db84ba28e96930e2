package com.handoff.backend.exception;

/**
 * Failure talking to the external helpdesk. Retryable by the caller.
 */
public class HelpdeskException extends RuntimeException {

    private final String operation;
    private final int statusCode;
    private final boolean timeout;

    public HelpdeskException(String operation, String message) {
        this(operation, message, -1, false, null);
    }

    public HelpdeskException(String operation, String message, Throwable cause) {
        this(operation, message, -1, false, cause);
    }

    public HelpdeskException(String operation, String message, int statusCode, boolean timeout, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
