package com.handoff.backend.service.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class AnalyticsMath {

    private AnalyticsMath() {
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Share of {@code part} in {@code total} as a percentage with one decimal, 0 when total is 0.
     */
    public static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round(part * 100.0 / total, 1);
    }

    /**
     * Change from {@code previous} to {@code current}. Changes inside the stable band count as stable;
     * growth from zero is reported as +100%.
     */
    public static Trend trend(double current, double previous, double stableBandPercent) {
        if (previous == 0) {
            return current > 0
                    ? new Trend(TrendDirection.INCREASING, 100.0, "+100%")
                    : Trend.stable();
        }
        double change = (current - previous) / previous * 100.0;
        TrendDirection direction;
        if (Math.abs(change) < stableBandPercent) {
            direction = TrendDirection.STABLE;
        } else {
            direction = change > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        String formatted = (change >= 0 ? "+" : "") + String.format(Locale.ROOT, "%.1f", change) + "%";
        return new Trend(direction, round(Math.abs(change), 1), formatted);
    }

    /**
     * Compares the mean of the second half of a series with the mean of the first half.
     * The midpoint is {@code size / 2}, so an odd middle element belongs to the second half.
     */
    public static Trend halfOverHalf(List<Long> series, double stableBandPercent) {
        if (series.size() < 2) {
            return Trend.stable();
        }
        int midpoint = series.size() / 2;
        double first = mean(series.subList(0, midpoint));
        double second = mean(series.subList(midpoint, series.size()));
        return trend(second, first, stableBandPercent);
    }

    public static Optional<ResolutionStats> stats(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        double mean = sorted.stream().mapToDouble(Double::doubleValue).sum() / n;
        double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2
                : sorted.get(n / 2);
        double variance = sorted.stream().mapToDouble(v -> Math.pow(v - mean, 2)).sum() / n;
        return Optional.of(new ResolutionStats(
                round(mean, 2),
                round(median, 2),
                round(sorted.get(0), 2),
                round(sorted.get(n - 1), 2),
                round(Math.sqrt(variance), 2)
        ));
    }

    private static double mean(List<Long> values) {
        return values.stream().mapToLong(Long::longValue).sum() / (double) values.size();
    }
}
