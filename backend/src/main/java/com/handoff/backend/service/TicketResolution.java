package com.handoff.backend.service;

import com.handoff.backend.model.Category;

public record TicketResolution(String ticketId, String ticketUrl, boolean created, Category category) {
}
