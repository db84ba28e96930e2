package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.analytics.TimePatternAnalyzer.HourBucket;
import com.handoff.backend.service.analytics.TimePatternAnalyzer.PeakPeriod;
import com.handoff.backend.service.analytics.TimePatternAnalyzer.TimePatternReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimePatternAnalyzerTest {

    private static final LocalDate MONDAY = LocalDate.parse("2025-03-03");

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final TimePatternAnalyzer analyzer = new TimePatternAnalyzer(properties);

    @Test
    void hourWithTripleVolumeIsPeakHour() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        for (int hour : new int[]{9, 10, 11, 12, 13, 15, 16}) {
            tickets.add(ticketAt(MONDAY, hour));
        }
        for (int i = 0; i < 3; i++) {
            tickets.add(ticketAt(MONDAY, 14));
        }

        TimePatternReport report = analyzer.analyze(tickets, MONDAY, MONDAY, null);

        assertThat(report.peakHours()).first().satisfies(bucket -> {
            assertThat(bucket.hour()).isEqualTo(14);
            assertThat(bucket.count()).isEqualTo(3);
        });
        assertThat(report.peakHours()).hasSize(5);
        assertThat(report.peakHours()).extracting(HourBucket::hour).containsExactly(14, 9, 10, 11, 12);
        assertThat(report.hourlyDistribution()).hasSize(24);
        assertThat(report.patterns().busiestHour()).isEqualTo("14:00");
        assertThat(report.patterns().busiestDay()).isEqualTo("Monday");
    }

    @Test
    void staffingUsesThroughputOverride() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            tickets.add(ticketAt(MONDAY, 10));
        }

        TimePatternReport byDefault = analyzer.analyze(tickets, MONDAY, MONDAY, null);
        TimePatternReport overridden = analyzer.analyze(tickets, MONDAY, MONDAY, 4.0);

        assertThat(byDefault.staffing().minimum().peak()).isEqualTo(2);
        assertThat(byDefault.staffing().ticketsPerStaffHour()).isEqualTo(6.0);
        assertThat(overridden.staffing().minimum().peak()).isEqualTo(3);
        assertThat(overridden.staffing().optimal().peak()).isEqualTo(5);
    }

    @Test
    void offPeakStaffingNeverDropsBelowTwo() {
        TimePatternReport quiet = analyzer.analyze(List.of(ticketAt(MONDAY, 9)), MONDAY, MONDAY, null);
        TimePatternReport empty = analyzer.analyze(List.of(), MONDAY, MONDAY, null);

        assertThat(quiet.staffing().minimum().offPeak()).isEqualTo(2);
        assertThat(quiet.staffing().optimal().offPeak()).isEqualTo(3);
        assertThat(empty.staffing().minimum().offPeak()).isZero();
    }

    @Test
    void peakPeriodsSkipPastMatchedWindow() {
        List<HourBucket> hourly = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            double perDay = hour >= 13 && hour <= 15 ? 3.0 : 0.0;
            hourly.add(new HourBucket(hour, TimePatternAnalyzer.formatHour(hour), (long) perDay, perDay));
        }
        double threshold = 9.0 / 24 * 1.5;

        List<PeakPeriod> periods = TimePatternAnalyzer.peakPeriods(hourly, threshold);

        // [11,12,13] already clears the threshold, so the scan resumes at 14
        assertThat(periods).containsExactly(new PeakPeriod(11, 14, 1.0), new PeakPeriod(14, 17, 2.0));
        assertThat(periods.get(1).label()).isEqualTo("14:00-17:00");
    }

    @Test
    void averagesUseDaysInRange() {
        LocalDate begin = LocalDate.parse("2025-03-02");
        LocalDate end = LocalDate.parse("2025-03-15");
        List<TicketHistoryRecord> tickets = List.of(ticketAt(MONDAY, 9), ticketAt(MONDAY.plusDays(7), 9));

        TimePatternReport report = analyzer.analyze(tickets, begin, end, null);

        assertThat(report.daysAnalyzed()).isEqualTo(14);
        assertThat(report.hourlyDistribution().get(9).avgPerDay()).isEqualTo(0.1);
        assertThat(report.dayOfWeekDistribution())
                .filteredOn(day -> day.day().equals("Monday"))
                .singleElement()
                .satisfies(day -> assertThat(day.avgPerOccurrence()).isEqualTo(1.0));
    }

    @Test
    void bucketsFollowConfiguredZone() {
        properties.setZone("America/New_York");
        // 02:00 UTC on Tuesday is 21:00 Monday in New York
        TicketHistoryRecord ticket = TicketHistoryRecord.builder()
                .ticketId("T1")
                .entryTime(Instant.parse("2025-03-04T02:00:00Z"))
                .build();

        TimePatternReport report = analyzer.analyze(List.of(ticket), MONDAY, MONDAY.plusDays(1), null);

        assertThat(report.hourlyDistribution().get(21).count()).isEqualTo(1);
        assertThat(report.patterns().busiestDay()).isEqualTo("Monday");
    }

    private static TicketHistoryRecord ticketAt(LocalDate day, int hour) {
        return TicketHistoryRecord.builder()
                .ticketId("T-" + day + "-" + hour)
                .entryTime(day.atTime(hour, 15).toInstant(ZoneOffset.UTC))
                .service("Internet")
                .category("WiFi")
                .billId("B1")
                .build();
    }
}
