package com.handoff.backend.service;

import com.handoff.backend.model.Category;
import com.handoff.backend.util.PhoneNumbers;

import java.util.ArrayList;
import java.util.List;

/**
 * Keys under which a ticket is remembered, most specific first.
 *
 * @param correlationKey  key derived from the agent's correlation key, or null
 * @param callerCategory  key derived from the normalized caller number and category, or null
 */
public record DedupKeys(String correlationKey, String callerCategory) {

    public static DedupKeys of(String correlationKey, String callerNumber, Category category) {
        String byCorrelation = isBlank(correlationKey) ? null : "oa:" + correlationKey.trim();
        String caller = PhoneNumbers.normalize(callerNumber);
        String byCaller = caller == null || category == null
                ? null
                : "caller:" + caller + ":" + category.name();
        return new DedupKeys(byCorrelation, byCaller);
    }

    public boolean isEmpty() {
        return correlationKey == null && callerCategory == null;
    }

    public List<String> all() {
        List<String> keys = new ArrayList<>(2);
        if (correlationKey != null) {
            keys.add(correlationKey);
        }
        if (callerCategory != null) {
            keys.add(callerCategory);
        }
        return keys;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
