package com.handoff.backend.service.helpdesk;

/**
 * Write side of the external helpdesk. Calls are slow and may fail; failures surface as
 * {@link com.handoff.backend.exception.HelpdeskException}.
 */
public interface HelpdeskClient {

    HelpdeskTicket createTicket(NewTicket ticket);

    NoteAppendResult appendNote(String ticketId, String note, String author);

    boolean healthCheck();
}
