package com.handoff.backend.service.classifier;

import java.util.List;
import java.util.Locale;

/**
 * Ordered rules plus the value returned when none match. First matching rule wins.
 */
public record RuleTable<T>(List<ClassificationRule<T>> rules, T fallback) {

    public RuleTable {
        rules = List.copyOf(rules);
    }

    public static <T> T classify(String text, RuleTable<T> table) {
        if (text == null || text.isBlank()) {
            return table.fallback();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (ClassificationRule<T> rule : table.rules()) {
            if (rule.matches(lowered)) {
                return rule.result();
            }
        }
        return table.fallback();
    }
}
