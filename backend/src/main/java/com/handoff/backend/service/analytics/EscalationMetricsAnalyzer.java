package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationMetricsAnalyzer {

    public static final String UNDER_4_HOURS = "<4h";
    public static final String FOUR_TO_8_HOURS = "4-8h";
    public static final String EIGHT_TO_24_HOURS = "8-24h";
    public static final String OVER_24_HOURS = ">24h";

    static final int TOP_REPEAT_CUSTOMERS = 10;
    static final int MAX_ISSUE_LENGTH = 100;

    private final AnalyticsProperties properties;

    public EscalationMetricsReport analyze(List<EscalationHistoryRecord> escalations, LocalDate begin, LocalDate end) {
        ZoneId zone = ZoneId.of(properties.getZone());
        int closedCount = (int) escalations.stream().filter(EscalationHistoryRecord::isClosed).count();
        List<EscalationHistoryRecord> closed = escalations.stream()
                .filter(escalation -> escalation.resolutionHours().isPresent())
                .toList();
        if (closed.size() < closedCount) {
            log.warn("Skipping {} closed escalations without a usable resolution time", closedCount - closed.size());
        }
        List<Double> hours = closed.stream()
                .map(escalation -> escalation.resolutionHours().orElseThrow())
                .toList();
        ResolutionStats stats = AnalyticsMath.stats(hours).orElse(null);

        Map<String, Long> distribution = new LinkedHashMap<>();
        distribution.put(UNDER_4_HOURS, 0L);
        distribution.put(FOUR_TO_8_HOURS, 0L);
        distribution.put(EIGHT_TO_24_HOURS, 0L);
        distribution.put(OVER_24_HOURS, 0L);
        hours.forEach(value -> distribution.merge(band(value), 1L, Long::sum));

        List<RepeatCustomer> repeatCustomers = repeatCustomers(escalations, zone);
        List<SlowResolution> slowest = closed.stream()
                .map(escalation -> new SlowResolution(
                        escalation.escalationId(),
                        escalation.billId(),
                        escalation.ticketId(),
                        AnalyticsMath.round(escalation.resolutionHours().orElseThrow(), 2),
                        truncate(escalation.summary() == null ? "Unknown" : escalation.summary())
                ))
                .sorted(Comparator.comparingDouble(SlowResolution::hours).reversed())
                .limit(properties.getEscalation().getSlowestLimit())
                .toList();

        return new EscalationMetricsReport(
                begin + " to " + end,
                escalations.size(),
                escalations.size() - closedCount,
                closedCount,
                stats == null ? null : stats.mean(),
                stats == null ? null : stats.median(),
                stats == null ? null : stats.min(),
                stats == null ? null : stats.max(),
                distribution,
                repeatCustomers,
                slowest,
                escalations.isEmpty() ? "No escalations found in this date range" : null
        );
    }

    /**
     * Resolution band for a closed escalation. Lower bounds are inclusive.
     */
    public static String band(double hours) {
        if (hours < 4) {
            return UNDER_4_HOURS;
        }
        if (hours < 8) {
            return FOUR_TO_8_HOURS;
        }
        if (hours < 24) {
            return EIGHT_TO_24_HOURS;
        }
        return OVER_24_HOURS;
    }

    private List<RepeatCustomer> repeatCustomers(List<EscalationHistoryRecord> escalations, ZoneId zone) {
        int threshold = properties.getEscalation().getRepeatThreshold();
        Map<String, List<EscalationHistoryRecord>> byCustomer = escalations.stream()
                .filter(escalation -> TicketVolumeAnalyzer.hasCustomer(escalation.billId()))
                .collect(Collectors.groupingBy(EscalationHistoryRecord::billId));
        return byCustomer.entrySet().stream()
                .filter(entry -> entry.getValue().size() >= threshold)
                .map(entry -> {
                    EscalationHistoryRecord latest = entry.getValue().stream()
                            .filter(escalation -> escalation.entryTime() != null)
                            .max(Comparator.comparing(EscalationHistoryRecord::entryTime))
                            .orElse(entry.getValue().get(0));
                    Instant latestTime = latest.entryTime();
                    return new RepeatCustomer(
                            entry.getKey(),
                            entry.getValue().size(),
                            latestTime == null ? null : latestTime.atZone(zone).toLocalDate(),
                            latest.escalationId(),
                            truncate(commonIssue(entry.getValue()))
                    );
                })
                .sorted(Comparator.comparingInt(RepeatCustomer::escalationCount).reversed()
                        .thenComparing(RepeatCustomer::billId))
                .limit(TOP_REPEAT_CUSTOMERS)
                .toList();
    }

    private static String commonIssue(List<EscalationHistoryRecord> escalations) {
        Map<String, Long> counts = escalations.stream()
                .map(EscalationHistoryRecord::summary)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(summary -> !summary.isEmpty())
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        // first seen wins a tie
        return counts.entrySet().stream()
                .reduce((best, candidate) -> candidate.getValue() > best.getValue() ? candidate : best)
                .map(Map.Entry::getKey)
                .orElse("Unknown");
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ISSUE_LENGTH ? text : text.substring(0, MAX_ISSUE_LENGTH);
    }

    public record EscalationMetricsReport(
            String period,
            int totalEscalations,
            int open,
            int closed,
            Double avgResolutionHours,
            Double medianResolutionHours,
            Double minResolutionHours,
            Double maxResolutionHours,
            Map<String, Long> resolutionDistribution,
            List<RepeatCustomer> repeatCustomers,
            List<SlowResolution> slowestResolutions,
            String message
    ) {
    }

    public record RepeatCustomer(String billId, int escalationCount, LocalDate lastEscalation,
                                 String lastEscalationId, String commonIssue) {
    }

    public record SlowResolution(String escalationId, String billId, String ticketId, double hours, String issue) {
    }
}
