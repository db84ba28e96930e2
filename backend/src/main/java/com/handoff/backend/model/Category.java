package com.handoff.backend.model;

import java.util.Arrays;
import java.util.Optional;

public enum Category {
    Outage,
    WiFi,
    CGNAT,
    Wiring,
    EquipmentReturn,
    Unknown;

    public static Optional<Category> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(category -> category.name().equals(trimmed))
                .findFirst();
    }
}
