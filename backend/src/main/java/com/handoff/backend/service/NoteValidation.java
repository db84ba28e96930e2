package com.handoff.backend.service;

import java.util.List;

/**
 * Outcome of checking a note against the 4-line contract.
 *
 * @param lineIndex 1-based index of the offending line, null when the note is valid or fails as a whole
 */
public record NoteValidation(boolean valid, String error, Integer lineIndex, int charCount, int lineCount,
                             List<String> lines) {

    static NoteValidation ok(int charCount, List<String> lines) {
        return new NoteValidation(true, null, null, charCount, lines.size(), lines);
    }

    static NoteValidation failed(String error, Integer lineIndex, int charCount, List<String> lines) {
        return new NoteValidation(false, error, lineIndex, charCount, lines.size(), lines);
    }
}
