package com.handoff.backend.model;

import java.util.Arrays;
import java.util.Optional;

public enum EscalationReason {
    CallerRequested,
    TwoStepsNoResolve,
    OutOfScope,
    SafetyRisk,
    BillingOrAccount,
    Other;

    public static Optional<EscalationReason> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(reason -> reason.name().equals(trimmed))
                .findFirst();
    }
}
