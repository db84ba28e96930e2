package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.service.analytics.EscalationMetricsAnalyzer.EscalationMetricsReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class EscalationMetricsAnalyzerTest {

    private static final Instant START = Instant.parse("2025-03-03T08:00:00Z");
    private static final LocalDate BEGIN = LocalDate.parse("2025-03-01");
    private static final LocalDate END = LocalDate.parse("2025-03-31");

    private final EscalationMetricsAnalyzer analyzer = new EscalationMetricsAnalyzer(new AnalyticsProperties());

    @Test
    void resolutionStatsAndBandsForClosedEscalations() {
        List<EscalationHistoryRecord> escalations = List.of(
                closed("E1", "B1", 2),
                closed("E2", "B2", 6),
                closed("E3", "B3", 30),
                open("E4", "B4"));

        EscalationMetricsReport report = analyzer.analyze(escalations, BEGIN, END);

        assertThat(report.totalEscalations()).isEqualTo(4);
        assertThat(report.open()).isEqualTo(1);
        assertThat(report.closed()).isEqualTo(3);
        assertThat(report.avgResolutionHours()).isEqualTo(12.67);
        assertThat(report.medianResolutionHours()).isEqualTo(6.0);
        assertThat(report.minResolutionHours()).isEqualTo(2.0);
        assertThat(report.maxResolutionHours()).isEqualTo(30.0);
        assertThat(report.resolutionDistribution()).containsExactly(
                entry("<4h", 1L), entry("4-8h", 1L), entry("8-24h", 0L), entry(">24h", 1L));
        assertThat(report.slowestResolutions()).extracting(EscalationMetricsAnalyzer.SlowResolution::escalationId)
                .containsExactly("E3", "E2", "E1");
    }

    @Test
    void customersAtThresholdAreRepeat() {
        List<EscalationHistoryRecord> escalations = List.of(
                closed("E1", "B1", 2),
                withSummary(closed("E2", "B1", 3), "Router reboots nightly"),
                withSummary(open("E3", "B1"), "Router reboots nightly"),
                closed("E4", "B2", 5));

        EscalationMetricsReport report = analyzer.analyze(escalations, BEGIN, END);

        assertThat(report.repeatCustomers()).singleElement().satisfies(customer -> {
            assertThat(customer.billId()).isEqualTo("B1");
            assertThat(customer.escalationCount()).isEqualTo(3);
            assertThat(customer.commonIssue()).isEqualTo("Router reboots nightly");
        });
    }

    @Test
    void closeBeforeEntryIsLeftOutOfResolutionStats() {
        EscalationHistoryRecord backwards = EscalationHistoryRecord.builder()
                .escalationId("E9")
                .billId("B9")
                .entryTime(START)
                .closeTime(START.minus(Duration.ofHours(5)))
                .build();

        EscalationMetricsReport report = analyzer.analyze(List.of(closed("E1", "B1", 2), backwards), BEGIN, END);

        assertThat(report.closed()).isEqualTo(2);
        assertThat(report.open()).isZero();
        assertThat(report.minResolutionHours()).isEqualTo(2.0);
        assertThat(report.avgResolutionHours()).isEqualTo(2.0);
        assertThat(report.resolutionDistribution()).containsEntry("<4h", 1L);
        assertThat(report.slowestResolutions()).extracting(EscalationMetricsAnalyzer.SlowResolution::escalationId)
                .containsExactly("E1");
    }

    @Test
    void escalationsWithoutBillIdAreNeverRepeatCustomers() {
        List<EscalationHistoryRecord> escalations = List.of(
                closed("E1", null, 2),
                closed("E2", null, 3),
                closed("E3", " ", 4));

        EscalationMetricsReport report = analyzer.analyze(escalations, BEGIN, END);

        assertThat(report.totalEscalations()).isEqualTo(3);
        assertThat(report.repeatCustomers()).isEmpty();
    }

    @Test
    void bandBoundariesAreInclusiveBelow() {
        assertThat(EscalationMetricsAnalyzer.band(3.99)).isEqualTo("<4h");
        assertThat(EscalationMetricsAnalyzer.band(4.0)).isEqualTo("4-8h");
        assertThat(EscalationMetricsAnalyzer.band(8.0)).isEqualTo("8-24h");
        assertThat(EscalationMetricsAnalyzer.band(24.0)).isEqualTo(">24h");
    }

    @Test
    void emptyInputHasNoStats() {
        EscalationMetricsReport report = analyzer.analyze(List.of(), BEGIN, END);

        assertThat(report.avgResolutionHours()).isNull();
        assertThat(report.message()).isNotNull();
        assertThat(report.repeatCustomers()).isEmpty();
    }

    private static EscalationHistoryRecord closed(String id, String billId, int hours) {
        return EscalationHistoryRecord.builder()
                .escalationId(id)
                .ticketId("T-" + id)
                .billId(billId)
                .entryTime(START)
                .closeTime(START.plus(Duration.ofHours(hours)))
                .summary("issue " + id)
                .build();
    }

    private static EscalationHistoryRecord open(String id, String billId) {
        return EscalationHistoryRecord.builder()
                .escalationId(id)
                .ticketId("T-" + id)
                .billId(billId)
                .entryTime(START.plus(Duration.ofDays(1)))
                .build();
    }

    private static EscalationHistoryRecord withSummary(EscalationHistoryRecord record, String summary) {
        return new EscalationHistoryRecord(record.escalationId(), record.ticketId(), record.billId(),
                record.entryTime(), record.closeTime(), summary);
    }
}
