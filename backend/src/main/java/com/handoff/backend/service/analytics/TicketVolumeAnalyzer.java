package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.Granularity;
import com.handoff.backend.model.TicketHistoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ticket counts per period with gap filling, a half-over-half trend and per-service breakdown.
 */
@Component
@RequiredArgsConstructor
public class TicketVolumeAnalyzer {

    static final int TOP_CATEGORIES = 10;
    static final int TOP_PEAKS = 5;
    static final int MAX_TIMELINE_BUCKETS = 31;
    static final String UNKNOWN = "Unknown";

    private final AnalyticsProperties properties;

    public TicketVolumeReport analyze(List<TicketHistoryRecord> tickets, LocalDate begin, LocalDate end,
                                      Granularity granularity) {
        Granularity effective = granularity == null ? Granularity.DAILY : granularity;
        ZoneId zone = ZoneId.of(properties.getZone());
        double band = properties.getTrend().getStableBandPercent();
        long dayCount = Math.max(1, ChronoUnit.DAYS.between(begin, end) + 1);

        List<TicketHistoryRecord> dated = tickets.stream()
                .filter(ticket -> ticket.entryTime() != null)
                .toList();
        Map<String, List<TicketHistoryRecord>> byBucket = new TreeMap<>(dated.stream()
                .collect(Collectors.groupingBy(ticket -> bucketKey(ticket, zone, effective))));
        List<String> bucketKeys = fillGaps(byBucket.keySet(), effective);
        List<Long> overallSeries = bucketKeys.stream()
                .map(key -> (long) byBucket.getOrDefault(key, List.of()).size())
                .toList();

        int total = tickets.size();
        Trend trend = AnalyticsMath.halfOverHalf(overallSeries, band);

        Map<String, Long> serviceCounts = countBy(tickets, TicketHistoryRecord::service);
        List<ServiceVolume> byService = serviceCounts.entrySet().stream()
                .map(entry -> {
                    List<Long> series = bucketKeys.stream()
                            .map(key -> byBucket.getOrDefault(key, List.of()).stream()
                                    .filter(ticket -> entry.getKey().equals(labelOf(ticket.service())))
                                    .count())
                            .toList();
                    Trend serviceTrend = AnalyticsMath.halfOverHalf(series, band);
                    return new ServiceVolume(
                            entry.getKey(),
                            entry.getValue(),
                            AnalyticsMath.percentage(entry.getValue(), total),
                            serviceTrend.direction(),
                            serviceTrend.formatted()
                    );
                })
                .sorted(Comparator.comparingLong(ServiceVolume::count).reversed()
                        .thenComparing(ServiceVolume::service))
                .toList();

        List<CategoryVolume> byCategory = countBy(tickets, TicketHistoryRecord::category).entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_CATEGORIES)
                .map(entry -> new CategoryVolume(entry.getKey(), entry.getValue(),
                        AnalyticsMath.percentage(entry.getValue(), total)))
                .toList();

        List<PeriodCount> timeline = new ArrayList<>();
        for (int i = 0; i < bucketKeys.size(); i++) {
            timeline.add(new PeriodCount(bucketKeys.get(i), overallSeries.get(i)));
        }
        List<PeriodCount> peaks = timeline.stream()
                .filter(period -> period.count() > 0)
                .sorted(Comparator.comparingLong(PeriodCount::count).reversed().thenComparing(PeriodCount::period))
                .limit(TOP_PEAKS)
                .toList();

        Summary summary = new Summary(
                byService.isEmpty() ? "None" : byService.get(0).service(),
                byCategory.isEmpty() ? "None" : byCategory.get(0).category(),
                peaks.isEmpty() ? "N/A" : peaks.get(0).period()
        );
        return new TicketVolumeReport(
                begin + " to " + end,
                effective,
                total,
                dayCount,
                AnalyticsMath.round(total / (double) dayCount, 1),
                trend.direction(),
                trend.formatted(),
                byService,
                byCategory,
                peaks,
                timeline.size() <= MAX_TIMELINE_BUCKETS ? timeline : null,
                summary,
                total == 0 ? "No tickets found in this date range" : null
        );
    }

    static String bucketKey(TicketHistoryRecord ticket, ZoneId zone, Granularity granularity) {
        LocalDate date = ticket.entryTime().atZone(zone).toLocalDate();
        return switch (granularity) {
            case DAILY -> date.toString();
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY)).toString();
            case MONTHLY -> YearMonth.from(date).toString();
        };
    }

    /**
     * Every bucket between the first and the last observed one, so quiet periods count as zero.
     */
    static List<String> fillGaps(Set<String> observed, Granularity granularity) {
        if (observed.isEmpty()) {
            return List.of();
        }
        List<String> sorted = observed.stream().sorted().toList();
        String first = sorted.get(0);
        String last = sorted.get(sorted.size() - 1);
        List<String> keys = new ArrayList<>();
        if (granularity == Granularity.MONTHLY) {
            YearMonth endMonth = YearMonth.parse(last);
            for (YearMonth month = YearMonth.parse(first); !month.isAfter(endMonth); month = month.plusMonths(1)) {
                keys.add(month.toString());
            }
            return keys;
        }
        int step = granularity == Granularity.WEEKLY ? 7 : 1;
        LocalDate endDate = LocalDate.parse(last);
        for (LocalDate date = LocalDate.parse(first); !date.isAfter(endDate); date = date.plusDays(step)) {
            keys.add(date.toString());
        }
        return keys;
    }

    private static Map<String, Long> countBy(List<TicketHistoryRecord> tickets,
                                             Function<TicketHistoryRecord, String> classifier) {
        Map<String, Long> counts = new HashMap<>();
        for (TicketHistoryRecord ticket : tickets) {
            counts.merge(labelOf(classifier.apply(ticket)), 1L, Long::sum);
        }
        return counts;
    }

    static String labelOf(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    static boolean hasCustomer(String billId) {
        return billId != null && !billId.isBlank();
    }

    public record TicketVolumeReport(
            String period,
            Granularity granularity,
            int totalTickets,
            long daysAnalyzed,
            double dailyAverage,
            TrendDirection trend,
            String trendPercentage,
            List<ServiceVolume> byService,
            List<CategoryVolume> byCategory,
            List<PeriodCount> peakPeriods,
            List<PeriodCount> timeline,
            Summary summary,
            String message
    ) {
    }

    public record ServiceVolume(String service, long count, double percentage, TrendDirection trend,
                                String trendPercentage) {
    }

    public record CategoryVolume(String category, long count, double percentage) {
    }

    public record PeriodCount(String period, long count) {
    }

    public record Summary(String mostActiveService, String mostCommonCategory, String busiestPeriod) {
    }
}
