package com.handoff.backend.exception;

import com.handoff.backend.dto.ApiErrorDetail;

import java.util.ArrayList;
import java.util.List;

/**
 * A note that breaks the 4-line / 350-character contract.
 */
public class NoteValidationException extends ValidationException {

    private final Integer lineIndex;
    private final int charCount;
    private final int lineCount;

    public NoteValidationException(String message, Integer lineIndex, int charCount, int lineCount) {
        super(message, details(message, lineIndex, charCount, lineCount));
        this.lineIndex = lineIndex;
        this.charCount = charCount;
        this.lineCount = lineCount;
    }

    private static List<ApiErrorDetail> details(String message, Integer lineIndex, int charCount, int lineCount) {
        List<ApiErrorDetail> details = new ArrayList<>();
        details.add(ApiErrorDetail.builder().field("note").issue(message).build());
        if (lineIndex != null) {
            details.add(ApiErrorDetail.builder().field("lineIndex").value(lineIndex).issue("offending line").build());
        }
        details.add(ApiErrorDetail.builder().field("charCount").value(charCount).issue("max 350").build());
        details.add(ApiErrorDetail.builder().field("lineCount").value(lineCount).issue("exactly 4").build());
        return details;
    }

    /** 1-based index of the offending line, or null when the note as a whole is at fault. */
    public Integer getLineIndex() {
        return lineIndex;
    }

    public int getCharCount() {
        return charCount;
    }

    public int getLineCount() {
        return lineCount;
    }
}
