package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Composite 0-100 health score per service.
 *
 * <pre>
 * score = 100 - (trendWeight * trendPenalty
 *              + escalationWeight * escalationPenalty
 *              + resolutionWeight * resolutionPenalty)
 * </pre>
 *
 * Each penalty is on 0..100. The trend penalty is 100 for an increasing volume and 0 otherwise.
 * The escalation penalty scales the escalation rate against its ceiling, the resolution penalty
 * scales the mean resolution hours against theirs; both are capped at 100. Weights, ceilings and
 * status thresholds come from {@code analytics.health.*}.
 */
@Component
@RequiredArgsConstructor
public class ServiceHealthAnalyzer {

    static final int HIGH_VOLUME_TICKETS = 100;
    static final int TOP_ISSUES = 5;

    private final AnalyticsProperties properties;

    public ServiceHealthReport analyze(List<TicketHistoryRecord> tickets,
                                       List<EscalationHistoryRecord> escalations,
                                       LocalDate begin, LocalDate end) {
        if (tickets.isEmpty()) {
            return new ServiceHealthReport(begin + " to " + end, null, null, List.of(), List.of(),
                    new Summary(0, escalations.size(), 0, 0, 0),
                    "No ticket data available for health analysis");
        }
        ZoneId zone = ZoneId.of(properties.getZone());
        Instant windowStart = begin.atStartOfDay(zone).toInstant();
        Instant windowEnd = end.plusDays(1).atStartOfDay(zone).toInstant();
        Instant midpoint = windowStart.plus(Duration.between(windowStart, windowEnd).dividedBy(2));

        Map<String, List<TicketHistoryRecord>> ticketsByService = tickets.stream()
                .collect(Collectors.groupingBy(ticket -> TicketVolumeAnalyzer.labelOf(ticket.service())));
        Map<String, String> serviceByTicket = new HashMap<>();
        tickets.stream()
                .filter(ticket -> ticket.ticketId() != null)
                .forEach(ticket -> serviceByTicket.putIfAbsent(ticket.ticketId(),
                        TicketVolumeAnalyzer.labelOf(ticket.service())));
        Map<String, List<EscalationHistoryRecord>> escalationsByService = escalations.stream()
                .collect(Collectors.groupingBy(escalation -> escalation.ticketId() == null
                        ? TicketVolumeAnalyzer.UNKNOWN
                        : serviceByTicket.getOrDefault(escalation.ticketId(), TicketVolumeAnalyzer.UNKNOWN)));

        List<ServiceHealth> services = ticketsByService.entrySet().stream()
                .map(entry -> score(entry.getKey(), entry.getValue(),
                        escalationsByService.getOrDefault(entry.getKey(), List.of()), midpoint))
                .sorted(Comparator.comparingDouble(ServiceHealth::healthScore)
                        .thenComparing(ServiceHealth::name))
                .toList();

        double overall = AnalyticsMath.round(services.stream()
                .mapToDouble(ServiceHealth::healthScore)
                .average()
                .orElse(100.0), 1);

        List<String> topIssues = new ArrayList<>();
        services.stream()
                .filter(service -> service.status() == HealthStatus.CRITICAL)
                .forEach(service -> topIssues.add(service.name() + ": " + service.recommendation()));
        services.stream()
                .filter(service -> service.ticketsTotal() > HIGH_VOLUME_TICKETS)
                .forEach(service -> topIssues.add(service.name() + ": High volume (" + service.ticketsTotal() + " tickets)"));

        Summary summary = new Summary(
                tickets.size(),
                escalations.size(),
                services.size(),
                (int) services.stream().filter(service -> service.status() == HealthStatus.CRITICAL).count(),
                (int) services.stream().filter(service -> service.status() == HealthStatus.HEALTHY).count()
        );
        return new ServiceHealthReport(
                begin + " to " + end,
                overall,
                status(overall),
                services,
                topIssues.stream().limit(TOP_ISSUES).toList(),
                summary,
                null
        );
    }

    ServiceHealth score(String service, List<TicketHistoryRecord> tickets,
                        List<EscalationHistoryRecord> escalations, Instant midpoint) {
        AnalyticsProperties.Health health = properties.getHealth();
        long firstHalf = tickets.stream()
                .map(TicketHistoryRecord::entryTime)
                .filter(Objects::nonNull)
                .filter(time -> time.isBefore(midpoint))
                .count();
        long secondHalf = tickets.stream()
                .map(TicketHistoryRecord::entryTime)
                .filter(Objects::nonNull)
                .filter(time -> !time.isBefore(midpoint))
                .count();
        Trend trend = AnalyticsMath.trend(secondHalf, firstHalf, properties.getTrend().getStableBandPercent());

        double escalationRate = AnalyticsMath.percentage(escalations.size(), tickets.size());
        double meanResolution = AnalyticsMath.stats(escalations.stream()
                        .map(EscalationHistoryRecord::resolutionHours)
                        .flatMap(Optional::stream)
                        .toList())
                .map(ResolutionStats::mean)
                .orElse(0.0);

        double trendPenalty = trend.direction() == TrendDirection.INCREASING ? 100.0 : 0.0;
        double escalationPenalty = Math.min(100.0, escalationRate / health.getEscalationRateCeilingPercent() * 100.0);
        double resolutionPenalty = Math.min(100.0, meanResolution / health.getResolutionHoursCeiling() * 100.0);
        double raw = 100.0 - (health.getTrendWeight() * trendPenalty
                + health.getEscalationWeight() * escalationPenalty
                + health.getResolutionWeight() * resolutionPenalty);
        double score = AnalyticsMath.round(Math.max(0.0, Math.min(100.0, raw)), 1);
        HealthStatus status = status(score);

        return new ServiceHealth(
                service,
                score,
                status,
                tickets.size(),
                trend.direction(),
                trend.formatted(),
                escalations.size(),
                escalationRate,
                AnalyticsMath.round(meanResolution, 1),
                recommendation(status, trend, escalationRate, escalationPenalty, resolutionPenalty)
        );
    }

    HealthStatus status(double score) {
        if (score >= properties.getHealth().getHealthyThreshold()) {
            return HealthStatus.HEALTHY;
        }
        if (score >= properties.getHealth().getAttentionThreshold()) {
            return HealthStatus.NEEDS_ATTENTION;
        }
        return HealthStatus.CRITICAL;
    }

    private static String recommendation(HealthStatus status, Trend trend, double escalationRate,
                                         double escalationPenalty, double resolutionPenalty) {
        boolean increasing = trend.direction() == TrendDirection.INCREASING;
        switch (status) {
            case HEALTHY:
                return "Performing well";
            case NEEDS_ATTENTION:
                if (escalationPenalty >= 40.0) {
                    return "High escalation rate (" + escalationRate + "%) - investigate root causes";
                }
                if (increasing) {
                    return "Ticket volume increasing - monitor capacity";
                }
                return "Monitor for improvement opportunities";
            default:
                List<String> issues = new ArrayList<>();
                if (escalationPenalty >= 80.0) {
                    issues.add("very high escalation rate");
                }
                if (resolutionPenalty >= 50.0) {
                    issues.add("slow resolution times");
                }
                if (increasing) {
                    issues.add("volume spike");
                }
                if (issues.isEmpty()) {
                    issues.add("several degraded indicators");
                }
                return "CRITICAL: " + String.join(", ", issues);
        }
    }

    public enum HealthStatus {
        HEALTHY,
        NEEDS_ATTENTION,
        CRITICAL
    }

    public record ServiceHealthReport(
            String period,
            Double overallHealthScore,
            HealthStatus overallStatus,
            List<ServiceHealth> services,
            List<String> topIssues,
            Summary summary,
            String message
    ) {
    }

    public record ServiceHealth(
            String name,
            double healthScore,
            HealthStatus status,
            int ticketsTotal,
            TrendDirection ticketsTrend,
            String ticketsTrendPercentage,
            int escalations,
            double escalationRate,
            double avgResolutionHours,
            String recommendation
    ) {
    }

    public record Summary(int totalTickets, int totalEscalations, int servicesMonitored,
                          int criticalServices, int healthyServices) {
    }
}
