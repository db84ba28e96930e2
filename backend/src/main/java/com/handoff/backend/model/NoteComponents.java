package com.handoff.backend.model;

import lombok.Builder;

/**
 * The four values carried by a canonical handoff note.
 */
@Builder(toBuilder = true)
public record NoteComponents(String category, String reason, String summary, String confidence) {
}
