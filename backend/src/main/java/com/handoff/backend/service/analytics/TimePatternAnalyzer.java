package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.TicketHistoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Hour-of-day and day-of-week histograms, peak detection and staffing estimates.
 */
@Component
@RequiredArgsConstructor
public class TimePatternAnalyzer {

    static final int TOP_PEAK_HOURS = 5;
    static final int PEAK_WINDOW_HOURS = 3;
    static final int MIN_OFF_PEAK_STAFF = 2;
    static final List<DayOfWeek> WEEK = List.of(
            DayOfWeek.SUNDAY, DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);

    private final AnalyticsProperties properties;

    /**
     * @param throughput tickets one staff member handles per hour; {@code null} uses the configured default
     */
    public TimePatternReport analyze(List<TicketHistoryRecord> tickets, LocalDate begin, LocalDate end,
                                     Double throughput) {
        double perStaffHour = throughput != null && throughput > 0
                ? throughput
                : properties.getStaffing().getTicketsPerStaffHour();
        ZoneId zone = ZoneId.of(properties.getZone());
        long dayCount = Math.max(1, ChronoUnit.DAYS.between(begin, end) + 1);

        long[] hourCounts = new long[24];
        long[] dayCounts = new long[7];
        for (TicketHistoryRecord ticket : tickets) {
            if (ticket.entryTime() == null) {
                continue;
            }
            ZonedDateTime local = ticket.entryTime().atZone(zone);
            hourCounts[local.getHour()]++;
            dayCounts[WEEK.indexOf(local.getDayOfWeek())]++;
        }

        List<HourBucket> hourly = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            hourly.add(new HourBucket(hour, formatHour(hour), hourCounts[hour],
                    AnalyticsMath.round(hourCounts[hour] / (double) dayCount, 1)));
        }
        List<DayBucket> daily = new ArrayList<>();
        for (int i = 0; i < WEEK.size(); i++) {
            DayOfWeek day = WEEK.get(i);
            long occurrences = Math.max(1, occurrences(begin, end, day));
            daily.add(new DayBucket(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), dayCounts[i],
                    AnalyticsMath.round(dayCounts[i] / (double) occurrences, 1)));
        }

        List<HourBucket> peakHours = hourly.stream()
                .filter(bucket -> bucket.count() > 0)
                .sorted(Comparator.comparingLong(HourBucket::count).reversed().thenComparingInt(HourBucket::hour))
                .limit(TOP_PEAK_HOURS)
                .toList();

        double avgHourly = hourly.stream().mapToDouble(HourBucket::avgPerDay).average().orElse(0.0);
        double maxHourly = hourly.stream().mapToDouble(HourBucket::avgPerDay).max().orElse(0.0);
        List<PeakPeriod> peakPeriods = peakPeriods(hourly, avgHourly * properties.getStaffing().getPeakMultiplier());

        DayBucket busiest = daily.stream()
                .reduce((best, candidate) -> candidate.count() > best.count() ? candidate : best)
                .orElseThrow();
        DayBucket quietest = daily.stream()
                .reduce((best, candidate) -> candidate.count() < best.count() ? candidate : best)
                .orElseThrow();
        HourBucket busiestHour = hourly.stream()
                .reduce((best, candidate) -> candidate.count() > best.count() ? candidate : best)
                .orElseThrow();

        int peakStaff = staff(maxHourly, perStaffHour);
        int offPeakStaff = tickets.isEmpty() ? 0 : Math.max(MIN_OFF_PEAK_STAFF, staff(avgHourly, perStaffHour));
        double weekendDaily = Math.max(daily.get(0).avgPerOccurrence(), daily.get(6).avgPerOccurrence());
        int weekendStaff = tickets.isEmpty() ? 0 : Math.max(1, staff(weekendDaily / 24.0, perStaffHour));
        Staffing minimum = new Staffing(peakStaff, offPeakStaff, weekendStaff);
        Staffing optimal = new Staffing(peakStaff + 2, offPeakStaff + 1, weekendStaff + 1);

        return new TimePatternReport(
                begin + " to " + end,
                tickets.size(),
                dayCount,
                hourly,
                daily,
                peakHours,
                peakPeriods,
                new Patterns(busiest.day(), quietest.day(), busiestHour.label(), AnalyticsMath.round(avgHourly, 1)),
                new StaffingRecommendation(minimum, optimal, perStaffHour),
                tickets.isEmpty() ? "No tickets found in this date range" : null
        );
    }

    /**
     * Scans 3-hour windows left to right. A window whose average exceeds the threshold is reported
     * and the scan resumes after it, so reported periods never overlap.
     */
    static List<PeakPeriod> peakPeriods(List<HourBucket> hourly, double threshold) {
        List<PeakPeriod> periods = new ArrayList<>();
        int i = 0;
        while (i + PEAK_WINDOW_HOURS <= hourly.size()) {
            double windowAverage = hourly.subList(i, i + PEAK_WINDOW_HOURS).stream()
                    .mapToDouble(HourBucket::avgPerDay)
                    .average()
                    .orElse(0.0);
            if (windowAverage > threshold && windowAverage > 0) {
                periods.add(new PeakPeriod(i, i + PEAK_WINDOW_HOURS, AnalyticsMath.round(windowAverage, 1)));
                i += PEAK_WINDOW_HOURS;
            } else {
                i++;
            }
        }
        return periods;
    }

    static int staff(double hourlyVolume, double perStaffHour) {
        return (int) Math.ceil(hourlyVolume / perStaffHour);
    }

    static long occurrences(LocalDate begin, LocalDate end, DayOfWeek day) {
        long count = 0;
        for (LocalDate date = begin; !date.isAfter(end); date = date.plusDays(1)) {
            if (date.getDayOfWeek() == day) {
                count++;
            }
        }
        return count;
    }

    static String formatHour(int hour) {
        return String.format(Locale.ROOT, "%02d:00", hour);
    }

    public record TimePatternReport(
            String period,
            int totalTickets,
            long daysAnalyzed,
            List<HourBucket> hourlyDistribution,
            List<DayBucket> dayOfWeekDistribution,
            List<HourBucket> peakHours,
            List<PeakPeriod> peakPeriods,
            Patterns patterns,
            StaffingRecommendation staffing,
            String message
    ) {
    }

    public record HourBucket(int hour, String label, long count, double avgPerDay) {
    }

    public record DayBucket(String day, long count, double avgPerOccurrence) {
    }

    /** Hours are [startHour, endHour). */
    public record PeakPeriod(int startHour, int endHour, double avgPerHour) {

        public String label() {
            return formatHour(startHour) + "-" + formatHour(endHour % 24);
        }
    }

    public record Patterns(String busiestDay, String quietestDay, String busiestHour, double avgTicketsPerHour) {
    }

    public record Staffing(int peak, int offPeak, int weekend) {
    }

    public record StaffingRecommendation(Staffing minimum, Staffing optimal, double ticketsPerStaffHour) {
    }
}
