package com.handoff.backend.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneNumbersTest {

    @ParameterizedTest
    @ValueSource(strings = {"+15551234567", "+1 555-123-4567", "(555) 123-4567", "5551234567", "1.555.123.4567"})
    void northAmericanSpellingsCollapseToE164(String raw) {
        assertThat(PhoneNumbers.normalize(raw)).isEqualTo("+15551234567");
    }

    @ParameterizedTest
    @CsvSource({
            "'+44 20 7946 0958', +442079460958",
            "'020 7946 0958', 02079460958",
            "'555-0101', 5550101"
    })
    void otherNumbersKeepTheirDigits(String raw, String expected) {
        assertThat(PhoneNumbers.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "unknown"})
    void inputWithoutDigitsHasNoNumber(String raw) {
        assertThat(PhoneNumbers.normalize(raw)).isNull();
    }
}
