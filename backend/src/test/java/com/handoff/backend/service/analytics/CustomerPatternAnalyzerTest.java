package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.ActionTier;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.CustomerPatternReport;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.HighTouchCustomer;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.KeywordCount;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerPatternAnalyzerTest {

    private static final LocalDate BEGIN = LocalDate.parse("2025-03-01");
    private static final LocalDate END = LocalDate.parse("2025-03-31");
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    private final CustomerPatternAnalyzer analyzer = new CustomerPatternAnalyzer(new AnalyticsProperties());

    @Test
    void tiersFollowEscalationCount() {
        assertThat(analyzer.tier(3)).isEqualTo(ActionTier.URGENT);
        assertThat(analyzer.tier(2)).isEqualTo(ActionTier.SCHEDULE_CALL);
        assertThat(analyzer.tier(1)).isEqualTo(ActionTier.MONITOR);
        assertThat(analyzer.tier(0)).isEqualTo(ActionTier.MONITOR);
    }

    @Test
    void highTouchCustomersAreRankedByWeightedPriority() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        tickets.addAll(tickets("B-VOLUME", "Internet", "WiFi", 12));
        tickets.addAll(tickets("B-CALL", "Voice", "Outage", 1));
        tickets.addAll(tickets("B-QUIET", "Voice", "Outage", 2));
        List<EscalationHistoryRecord> escalations = new ArrayList<>();
        escalations.addAll(escalations("B-URGENT", 3));
        escalations.addAll(escalations("B-CALL", 2));

        CustomerPatternReport report = analyzer.analyze(tickets, escalations, BEGIN, END);

        // 30, 21, 12; B-QUIET stays below both thresholds
        assertThat(report.highTouchCustomers()).extracting(HighTouchCustomer::billId)
                .containsExactly("B-URGENT", "B-CALL", "B-VOLUME");
        assertThat(report.highTouchCustomers()).extracting(HighTouchCustomer::action)
                .containsExactly(ActionTier.URGENT, ActionTier.SCHEDULE_CALL, ActionTier.MONITOR);

        HighTouchCustomer urgent = report.highTouchCustomers().get(0);
        assertThat(urgent.totalTickets()).isZero();
        assertThat(urgent.lastContact()).isNull();
        assertThat(urgent.recommendation()).startsWith("URGENT: 3 escalations");

        HighTouchCustomer call = report.highTouchCustomers().get(1);
        assertThat(call.recommendation()).isEqualTo("Schedule proactive call - recurring Voice - Outage issues");

        HighTouchCustomer volume = report.highTouchCustomers().get(2);
        assertThat(volume.primaryIssue()).isEqualTo("Internet - WiFi");
        assertThat(volume.recommendation()).isEqualTo("High volume customer - consider account review");
        assertThat(volume.recentTickets()).hasSize(5);
        assertThat(volume.lastContact()).isEqualTo(LocalDate.parse("2025-03-12"));

        assertThat(report.summary().totalCustomersAnalyzed()).isEqualTo(3);
        assertThat(report.summary().customersWithEscalations()).isEqualTo(2);
        assertThat(report.summary().highTouchCount()).isEqualTo(3);
    }

    @Test
    void keywordsSkipShortAndStopWords() {
        List<KeywordCount> keywords = CustomerPatternAnalyzer.topKeywords(List.of(
                "Router keeps rebooting!",
                "router rebooting again",
                "The modem is fine"), 20);

        assertThat(keywords).startsWith(new KeywordCount("rebooting", 2), new KeywordCount("router", 2));
        assertThat(keywords).extracting(KeywordCount::keyword)
                .contains("keeps", "again", "modem", "fine")
                .doesNotContain("the", "is");
    }

    @Test
    void keywordLimitIsApplied() {
        assertThat(CustomerPatternAnalyzer.topKeywords(List.of("alpha bravo charlie delta"), 2))
                .extracting(KeywordCount::keyword)
                .containsExactly("alpha", "bravo");
    }

    @Test
    void patternAcrossManyCustomersIsSystemic() {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            tickets.addAll(tickets("B" + i, "Internet", "CGNAT", 1));
        }
        tickets.addAll(tickets("B0", "Voice", null, 3));

        CustomerPatternReport report = analyzer.analyze(tickets, List.of(), BEGIN, END);

        assertThat(report.issuePatterns()).first().satisfies(pattern -> {
            assertThat(pattern.pattern()).isEqualTo("Internet - CGNAT");
            assertThat(pattern.affectedCustomers()).isEqualTo(11);
            assertThat(pattern.systemic()).isTrue();
        });
        assertThat(report.issuePatterns().get(1).pattern()).isEqualTo("Voice - General");
        assertThat(report.issuePatterns().get(1).systemic()).isFalse();
        assertThat(report.summary().mostCommonIssue()).isEqualTo("Internet - CGNAT");
    }

    @Test
    void recordsWithoutBillIdAreNotACustomer() {
        List<TicketHistoryRecord> tickets = new ArrayList<>(tickets(null, "Internet", "WiFi", 8));
        List<EscalationHistoryRecord> escalations = escalations(null, 3);

        CustomerPatternReport report = analyzer.analyze(tickets, escalations, BEGIN, END);

        assertThat(report.highTouchCustomers()).isEmpty();
        assertThat(report.summary().totalCustomersAnalyzed()).isZero();
    }

    @Test
    void emptyInputHasMessage() {
        CustomerPatternReport report = analyzer.analyze(List.of(), List.of(), BEGIN, END);

        assertThat(report.highTouchCustomers()).isEmpty();
        assertThat(report.message()).isNotBlank();
    }

    private static List<TicketHistoryRecord> tickets(String billId, String service, String category, int count) {
        List<TicketHistoryRecord> tickets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tickets.add(TicketHistoryRecord.builder()
                    .ticketId(billId + "-T" + i)
                    .billId(billId)
                    .service(service)
                    .category(category)
                    .entryTime(START.plusSeconds(86_400L * i))
                    .description("Connection drops")
                    .build());
        }
        return tickets;
    }

    private static List<EscalationHistoryRecord> escalations(String billId, int count) {
        List<EscalationHistoryRecord> escalations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            escalations.add(EscalationHistoryRecord.builder()
                    .escalationId(billId + "-E" + i)
                    .billId(billId)
                    .entryTime(START)
                    .build());
        }
        return escalations;
    }
}
