package com.handoff.backend.service.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * One row of a rule table: when {@code predicate} matches the lowercased text, the table yields {@code result}.
 */
public record ClassificationRule<T>(String name, Predicate<String> predicate, T result) {

    public static <T> ClassificationRule<T> anyKeyword(T result, String... keywords) {
        List<String> lowered = Arrays.stream(keywords)
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
        return new ClassificationRule<>(result + lowered.toString(),
                text -> lowered.stream().anyMatch(text::contains), result);
    }

    public boolean matches(String lowercasedText) {
        return predicate.test(lowercasedText);
    }
}
