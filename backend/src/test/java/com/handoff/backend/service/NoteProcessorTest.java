package com.handoff.backend.service;

import com.handoff.backend.exception.NoteValidationException;
import com.handoff.backend.exception.ValidationException;
import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.NoteComponents;
import com.handoff.backend.service.classifier.KeywordNoteClassifier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoteProcessorTest {

    private final NoteProcessor noteProcessor = new NoteProcessor(new KeywordNoteClassifier());

    @Test
    void rendersCanonicalFourLineNote() {
        String note = noteProcessor.render(NoteComponents.builder()
                .category("WiFi")
                .reason("TwoStepsNoResolve")
                .summary("Customer cannot connect after reset")
                .confidence("0.8")
                .build());

        assertThat(note).isEqualTo("Category: WiFi\nReason: TwoStepsNoResolve\n"
                + "Summary: Customer cannot connect after reset\nConfidence: 0.8");
        assertThat(noteProcessor.validate(note).valid()).isTrue();
    }

    @Test
    void rejectsNoteOverLengthLimit() {
        String longSummary = "x".repeat(400);

        NoteValidation validation = noteProcessor.validate(
                "Category: WiFi\nReason: Other\nSummary: " + longSummary + "\nConfidence: 0.5");

        assertThat(validation.valid()).isFalse();
        assertThat(validation.error()).contains("350");
        assertThat(validation.charCount()).isGreaterThan(NoteProcessor.MAX_NOTE_LENGTH);
    }

    @Test
    void reportsOffendingLineForWrongLabel() {
        NoteValidation validation = noteProcessor.validate("Category: WiFi\nCause: Other\nSummary: s\nConfidence: 0.5");

        assertThat(validation.valid()).isFalse();
        assertThat(validation.lineIndex()).isEqualTo(2);
        assertThat(validation.error()).contains("Reason:");
    }

    @Test
    void reportsWrongLineCount() {
        NoteValidation validation = noteProcessor.validate("Category: WiFi\nReason: Other\nSummary: s");

        assertThat(validation.valid()).isFalse();
        assertThat(validation.lineCount()).isEqualTo(3);
    }

    @Test
    void strictRenderRejectsMultiLineSummary() {
        assertThatThrownBy(() -> noteProcessor.render(NoteComponents.builder()
                .category("WiFi")
                .reason("Other")
                .summary("first line\nsecond line")
                .confidence("0.5")
                .build()))
                .isInstanceOf(NoteValidationException.class);
    }

    @Test
    void fittingRenderTruncatesSummaryToLimit() {
        String note = noteProcessor.renderFitting(NoteComponents.builder()
                .category("Outage")
                .reason("Other")
                .summary("word ".repeat(200))
                .confidence("0.9")
                .build());

        assertThat(note.length()).isLessThanOrEqualTo(NoteProcessor.MAX_NOTE_LENGTH);
        assertThat(note.split("\n")[2]).endsWith("...");
        assertThat(noteProcessor.validate(note).valid()).isTrue();
    }

    @Test
    void truncationNeverSplitsASurrogatePair() {
        for (String lead : new String[]{"", "a"}) {
            String note = noteProcessor.renderFitting(NoteComponents.builder()
                    .category("Outage")
                    .reason("Other")
                    .summary(lead + "\uD83D\uDCF6".repeat(300))
                    .confidence("0.9")
                    .build());

            assertThat(note.length()).isLessThanOrEqualTo(NoteProcessor.MAX_NOTE_LENGTH);
            assertThat(note.codePoints())
                    .noneMatch(cp -> cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE);
            assertThat(note.split("\n")[2]).endsWith("\uD83D\uDCF6...");
        }
    }

    @Test
    void cutBacksOffBeforeHighSurrogate() {
        String text = "ab\uD83D\uDCF6cd";

        assertThat(NoteProcessor.cut(text, 3)).isEqualTo("ab");
        assertThat(NoteProcessor.cut(text, 4)).isEqualTo("ab\uD83D\uDCF6");
        assertThat(NoteProcessor.cut(text, 2)).isEqualTo("ab");
    }

    @Test
    void parseReturnsLabelValues() {
        NoteComponents parsed = noteProcessor.parse("Category: CGNAT\nReason: OutOfScope\nSummary: needs public ip\nConfidence: 1.0");

        assertThat(parsed.category()).isEqualTo("CGNAT");
        assertThat(parsed.reason()).isEqualTo("OutOfScope");
        assertThat(parsed.summary()).isEqualTo("needs public ip");
        assertThat(parsed.confidence()).isEqualTo("1.0");
    }

    @Test
    void resolveInfersFromFreeText() {
        ResolvedNote resolved = noteProcessor.resolve("Customer can't connect to WiFi after reset, tried twice",
                null, null, null, null);

        assertThat(resolved.category()).isEqualTo(Category.WiFi);
        assertThat(resolved.reason()).isEqualTo(EscalationReason.TwoStepsNoResolve);
        assertThat(resolved.confidence()).isEqualTo(NoteProcessor.DEFAULT_CONFIDENCE);
        assertThat(resolved.note()).startsWith("Category: WiFi\nReason: TwoStepsNoResolve\n");
    }

    @Test
    void resolvePrefersExplicitValuesOverPreRenderedLabels() {
        String note = "Category: WiFi\nReason: Other\nSummary: billing question\nConfidence: 0.4";

        ResolvedNote resolved = noteProcessor.resolve(note, null, Category.Outage, null, "0.9");

        assertThat(resolved.category()).isEqualTo(Category.Outage);
        assertThat(resolved.reason()).isEqualTo(EscalationReason.Other);
        assertThat(resolved.confidence()).isEqualTo("0.9");
        assertThat(resolved.summary()).isEqualTo("billing question");
    }

    @Test
    void resolveRequiresNoteOrSummary() {
        assertThatThrownBy(() -> noteProcessor.resolve(" ", null, null, null, null))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getDetails())
                        .singleElement()
                        .satisfies(detail -> assertThat(detail.getField()).isEqualTo("note")));
    }

    @Test
    void confidenceOutsideRangeIsRejected() {
        assertThatThrownBy(() -> noteProcessor.validateConfidence("1.5"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("confidence");
        assertThat(noteProcessor.validateConfidence(" 0.25 ")).isEqualTo(0.25);
    }

    @Test
    void sanitizeDropsControlCharacters() {
        assertThat(noteProcessor.sanitize("  hello\u0000 world\u0007 ")).isEqualTo("hello world");
        assertThat(noteProcessor.sanitize("abcdef", 3)).isEqualTo("abc");
        assertThat(noteProcessor.sanitize(null)).isEmpty();
    }
}
