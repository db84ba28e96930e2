package com.handoff.backend.util;

/**
 * Caller number normalization.
 * <p>
 * North American numbers in any common spelling ({@code +1 555-123-4567}, {@code (555) 123-4567},
 * {@code 5551234567}) collapse to E.164 {@code +15551234567}. Anything else keeps its digits and a
 * leading {@code +} when one was given, so foreign numbers still compare equal to themselves.
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /**
     * @return the normalized number, or null when the input holds no digits
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() == 10) {
            return "+1" + digits;
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+" + digits;
        }
        return raw.trim().startsWith("+") ? "+" + digits : digits;
    }
}
