package com.handoff.backend.service.helpdesk;

public record HelpdeskTicket(String id, String url) {
}
