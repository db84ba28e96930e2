package com.handoff.backend.service.helpdesk;

public record NoteAppendResult(boolean success, String message) {
}
