package com.handoff.backend.exception;

/**
 * The ticket exists (created or found) but the note could not be appended. Only the append needs a retry.
 */
public class NoteAppendException extends HelpdeskException {

    private final String ticketId;
    private final String ticketUrl;
    private final boolean created;

    public NoteAppendException(String ticketId, String ticketUrl, boolean created, HelpdeskException cause) {
        super("appendNote", "Ticket " + ticketId + " is recorded but the note was not appended: " + cause.getMessage(),
                cause.getStatusCode(), cause.isTimeout(), cause);
        this.ticketId = ticketId;
        this.ticketUrl = ticketUrl;
        this.created = created;
    }

    public String getTicketId() {
        return ticketId;
    }

    public String getTicketUrl() {
        return ticketUrl;
    }

    public boolean isCreated() {
        return created;
    }
}
