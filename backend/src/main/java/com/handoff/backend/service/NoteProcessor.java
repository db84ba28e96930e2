package com.handoff.backend.service;

import com.handoff.backend.exception.NoteValidationException;
import com.handoff.backend.exception.ValidationException;
import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.NoteComponents;
import com.handoff.backend.service.classifier.NoteClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Renders, parses and validates the canonical handoff note:
 * <pre>
 * Category: WiFi
 * Reason: TwoStepsNoResolve
 * Summary: Customer cannot connect after reset
 * Confidence: 0.8
 * </pre>
 * Exactly four labelled lines, at most 350 characters in total.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoteProcessor {

    public static final int MAX_NOTE_LENGTH = 350;
    public static final int LINE_COUNT = 4;
    public static final String DEFAULT_CONFIDENCE = "0.0";

    static final String CATEGORY_LABEL = "Category:";
    static final String REASON_LABEL = "Reason:";
    static final String SUMMARY_LABEL = "Summary:";
    static final String CONFIDENCE_LABEL = "Confidence:";
    private static final List<String> LABELS = List.of(CATEGORY_LABEL, REASON_LABEL, SUMMARY_LABEL, CONFIDENCE_LABEL);
    private static final String ELLIPSIS = "...";

    private final NoteClassifier noteClassifier;

    public NoteValidation validate(String note) {
        if (note == null) {
            return NoteValidation.failed("Note is required", null, 0, List.of());
        }
        int charCount = note.length();
        List<String> lines = Arrays.asList(note.split("\n", -1));
        if (charCount > MAX_NOTE_LENGTH) {
            return NoteValidation.failed("Note exceeds " + MAX_NOTE_LENGTH + " characters (current: " + charCount + ")",
                    null, charCount, lines);
        }
        if (lines.size() != LINE_COUNT) {
            Integer offending = lines.size() > LINE_COUNT ? LINE_COUNT + 1 : null;
            return NoteValidation.failed("Note must be exactly " + LINE_COUNT + " lines (current: " + lines.size() + ")",
                    offending, charCount, lines);
        }
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().isEmpty()) {
                return NoteValidation.failed("Line " + (i + 1) + " is empty", i + 1, charCount, lines);
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            String label = LABELS.get(i);
            if (!line.startsWith(label)) {
                return NoteValidation.failed("Line " + (i + 1) + " should start with \"" + label + "\"",
                        i + 1, charCount, lines);
            }
            if (line.substring(label.length()).trim().isEmpty()) {
                return NoteValidation.failed("Line " + (i + 1) + " has no value after \"" + label + "\"",
                        i + 1, charCount, lines);
            }
        }
        return NoteValidation.ok(charCount, lines);
    }

    public void requireValid(String note) {
        NoteValidation validation = validate(note);
        if (!validation.valid()) {
            throw new NoteValidationException(validation.error(), validation.lineIndex(),
                    validation.charCount(), validation.lineCount());
        }
    }

    /**
     * Renders the note exactly as given. Anything that would break the contract is rejected.
     */
    public String render(NoteComponents components) {
        String note = String.join("\n",
                CATEGORY_LABEL + " " + sanitize(components.category()),
                REASON_LABEL + " " + sanitize(components.reason()),
                SUMMARY_LABEL + " " + sanitize(components.summary()),
                CONFIDENCE_LABEL + " " + sanitize(components.confidence()));
        NoteValidation validation = validate(note);
        if (!validation.valid()) {
            throw new NoteValidationException("Rendered note failed validation: " + validation.error(),
                    validation.lineIndex(), validation.charCount(), validation.lineCount());
        }
        return note;
    }

    /**
     * Renders the note, flattening each value onto one line and shortening the summary until the note fits.
     */
    public String renderFitting(NoteComponents components) {
        String category = flatten(components.category());
        String reason = flatten(components.reason());
        String confidence = flatten(components.confidence());
        String summary = flatten(components.summary());
        int fixed = CATEGORY_LABEL.length() + REASON_LABEL.length() + SUMMARY_LABEL.length() + CONFIDENCE_LABEL.length()
                + 4 + category.length() + reason.length() + confidence.length() + (LINE_COUNT - 1);
        int budget = MAX_NOTE_LENGTH - fixed;
        if (summary.length() > budget && budget > ELLIPSIS.length()) {
            log.debug("Truncating summary from {} to {} characters", summary.length(), budget);
            summary = cut(summary, budget - ELLIPSIS.length()).trim() + ELLIPSIS;
        }
        return render(new NoteComponents(category, reason, summary, confidence));
    }

    public NoteComponents parse(String note) {
        NoteValidation validation = validate(note);
        if (!validation.valid()) {
            throw new NoteValidationException("Cannot parse invalid note: " + validation.error(),
                    validation.lineIndex(), validation.charCount(), validation.lineCount());
        }
        List<String> lines = validation.lines();
        return NoteComponents.builder()
                .category(valueOf(lines.get(0), CATEGORY_LABEL))
                .reason(valueOf(lines.get(1), REASON_LABEL))
                .summary(valueOf(lines.get(2), SUMMARY_LABEL))
                .confidence(valueOf(lines.get(3), CONFIDENCE_LABEL))
                .build();
    }

    public boolean isPreRendered(String note) {
        return note != null && note.stripLeading().startsWith(CATEGORY_LABEL);
    }

    public Category inferCategory(String text) {
        return noteClassifier.inferCategory(text);
    }

    public EscalationReason inferReason(String text) {
        return noteClassifier.inferReason(text);
    }

    /**
     * Works out category, reason, confidence and the canonical note for an inbound handoff.
     * Explicit values win, then the labels on a pre-rendered note, then keyword inference.
     */
    public ResolvedNote resolve(String note, String summary, Category category, EscalationReason reason,
                                String confidence) {
        boolean hasNote = note != null && !note.isBlank();
        boolean hasSummary = summary != null && !summary.isBlank();
        if (!hasNote && !hasSummary) {
            throw ValidationException.forField("note", note, "note or summary is required");
        }
        Category resolvedCategory;
        EscalationReason resolvedReason;
        String resolvedConfidence;
        String resolvedSummary;
        if (hasNote && isPreRendered(note)) {
            String cleaned = sanitize(note.strip());
            NoteComponents parsed = parse(cleaned);
            resolvedSummary = hasSummary ? summary : parsed.summary();
            resolvedCategory = category != null ? category
                    : Category.fromLabel(parsed.category()).orElseGet(() -> inferCategory(parsed.summary()));
            resolvedReason = reason != null ? reason
                    : EscalationReason.fromLabel(parsed.reason()).orElseGet(() -> inferReason(parsed.summary()));
            resolvedConfidence = confidence != null ? confidence : parsed.confidence();
        } else {
            String text = hasNote ? note : summary;
            resolvedSummary = hasSummary ? summary : note;
            resolvedCategory = category != null ? category : inferCategory(text);
            resolvedReason = reason != null ? reason : inferReason(text);
            resolvedConfidence = confidence != null ? confidence : DEFAULT_CONFIDENCE;
        }
        validateConfidence(resolvedConfidence);
        String rendered = renderFitting(NoteComponents.builder()
                .category(resolvedCategory.name())
                .reason(resolvedReason.name())
                .summary(resolvedSummary)
                .confidence(resolvedConfidence.trim())
                .build());
        return ResolvedNote.builder()
                .category(resolvedCategory)
                .reason(resolvedReason)
                .confidence(resolvedConfidence.trim())
                .summary(resolvedSummary)
                .note(rendered)
                .build();
    }

    public double validateConfidence(String confidence) {
        if (confidence == null) {
            throw ValidationException.forField("confidence", null, "must be a number from 0.0 to 1.0");
        }
        double value;
        try {
            value = Double.parseDouble(confidence.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.forField("confidence", confidence, "must be a number from 0.0 to 1.0");
        }
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw ValidationException.forField("confidence", confidence, "must be between 0.0 and 1.0");
        }
        return value;
    }

    /**
     * Drops control characters other than newline and tab, then trims.
     */
    public String sanitize(String text) {
        return sanitize(text, Integer.MAX_VALUE);
    }

    public String sanitize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        StringBuilder cleaned = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> cp == '\n' || cp == '\t' || !Character.isISOControl(cp))
                .forEach(cleaned::appendCodePoint);
        String result = cleaned.toString().trim();
        return result.length() > maxLength ? cut(result, maxLength) : result;
    }

    /**
     * Prefix of at most {@code end} chars that never ends inside a surrogate pair.
     */
    static String cut(String text, int end) {
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private String flatten(String value) {
        return sanitize(value).replaceAll("\\s+", " ");
    }

    private String valueOf(String line, String label) {
        return line.trim().substring(label.length()).trim();
    }
}
