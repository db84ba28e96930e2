package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.analytics.ServiceHealthAnalyzer.HealthStatus;
import com.handoff.backend.service.analytics.ServiceHealthAnalyzer.ServiceHealth;
import com.handoff.backend.service.analytics.ServiceHealthAnalyzer.ServiceHealthReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceHealthAnalyzerTest {

    private static final LocalDate BEGIN = LocalDate.parse("2025-03-01");
    private static final LocalDate END = LocalDate.parse("2025-03-10");
    private static final Instant EARLY = Instant.parse("2025-03-02T12:00:00Z");
    private static final Instant LATE = Instant.parse("2025-03-08T12:00:00Z");

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final ServiceHealthAnalyzer analyzer = new ServiceHealthAnalyzer(properties);

    @Test
    void quietServiceIsHealthy() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        tickets.addAll(tickets("Voice", EARLY, 2));
        tickets.addAll(tickets("Voice", LATE, 2));

        ServiceHealthReport report = analyzer.analyze(tickets, List.of(), BEGIN, END);

        assertThat(report.services()).singleElement().satisfies(service -> {
            assertThat(service.healthScore()).isEqualTo(100.0);
            assertThat(service.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(service.recommendation()).isEqualTo("Performing well");
        });
        assertThat(report.overallStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void weightedPenaltiesProduceNeedsAttention() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        tickets.addAll(tickets("Internet", EARLY, 5));
        tickets.addAll(tickets("Internet", LATE, 5));
        // 10% escalation rate -> penalty 40, 12h mean resolution -> penalty 25, stable trend
        EscalationHistoryRecord escalation = escalation(tickets.get(0).ticketId(), 12);

        ServiceHealth service = analyzer.analyze(tickets, List.of(escalation), BEGIN, END).services().get(0);

        assertThat(service.escalationRate()).isEqualTo(10.0);
        assertThat(service.avgResolutionHours()).isEqualTo(12.0);
        assertThat(service.healthScore()).isEqualTo(74.0);
        assertThat(service.status()).isEqualTo(HealthStatus.NEEDS_ATTENTION);
        assertThat(service.recommendation()).startsWith("High escalation rate");
    }

    @Test
    void risingVolumeWithSlowEscalationsIsCritical() {
        List<TicketHistoryRecord> tickets = new ArrayList<>(tickets("Internet", LATE, 4));
        List<EscalationHistoryRecord> escalations = List.of(
                escalation(tickets.get(0).ticketId(), 60),
                escalation(tickets.get(1).ticketId(), 50));

        ServiceHealthReport report = analyzer.analyze(tickets, escalations, BEGIN, END);

        ServiceHealth service = report.services().get(0);
        assertThat(service.healthScore()).isZero();
        assertThat(service.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(service.recommendation())
                .contains("very high escalation rate", "slow resolution times", "volume spike");
        assertThat(report.topIssues()).singleElement().asString().startsWith("Internet: CRITICAL");
        assertThat(report.summary().criticalServices()).isEqualTo(1);
    }

    @Test
    void weightsAreConfigurable() {
        properties.getHealth().setTrendWeight(0.0);
        properties.getHealth().setEscalationWeight(0.0);
        properties.getHealth().setResolutionWeight(1.0);
        List<TicketHistoryRecord> tickets = new ArrayList<>(tickets("Internet", LATE, 4));

        ServiceHealth service = analyzer.analyze(tickets, List.of(escalation(tickets.get(0).ticketId(), 24)),
                BEGIN, END).services().get(0);

        assertThat(service.healthScore()).isEqualTo(50.0);
        assertThat(service.status()).isEqualTo(HealthStatus.NEEDS_ATTENTION);
    }

    @Test
    void servicesAreOrderedWorstFirst() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        tickets.addAll(tickets("Voice", EARLY, 1));
        tickets.addAll(tickets("Voice", LATE, 1));
        tickets.addAll(tickets("Internet", LATE, 2));

        ServiceHealthReport report = analyzer.analyze(tickets, List.of(), BEGIN, END);

        assertThat(report.services()).extracting(ServiceHealth::name).containsExactly("Internet", "Voice");
        assertThat(report.overallHealthScore()).isEqualTo(90.0);
    }

    @Test
    void noTicketsGivesMessageInsteadOfScore() {
        ServiceHealthReport report = analyzer.analyze(List.of(), List.of(), BEGIN, END);

        assertThat(report.overallHealthScore()).isNull();
        assertThat(report.message()).isNotBlank();
    }

    private static List<TicketHistoryRecord> tickets(String service, Instant at, int count) {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tickets.add(TicketHistoryRecord.builder()
                    .ticketId(service + "-" + at.getEpochSecond() + "-" + i)
                    .entryTime(at.plusSeconds(i))
                    .service(service)
                    .category("General")
                    .build());
        }
        return tickets;
    }

    private static EscalationHistoryRecord escalation(String ticketId, int hours) {
        return EscalationHistoryRecord.builder()
                .escalationId("E-" + ticketId)
                .ticketId(ticketId)
                .billId("B1")
                .entryTime(EARLY)
                .closeTime(EARLY.plus(Duration.ofHours(hours)))
                .build();
    }
}
