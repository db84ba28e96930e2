package com.handoff.backend.service.analytics;

/**
 * Percent change between two periods. {@code percentage} is the absolute change,
 * {@code formatted} carries the sign, e.g. {@code +12.5%}.
 */
public record Trend(TrendDirection direction, double percentage, String formatted) {

    public static Trend stable() {
        return new Trend(TrendDirection.STABLE, 0.0, "0%");
    }
}
