package com.handoff.backend.controller;

import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.helpdesk.InMemoryHelpdeskClient;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AnalyticsControllerTest {

    private static final String TOKEN = "test-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryHelpdeskClient helpdeskClient;

    @BeforeAll
    void seedHistory() {
        helpdeskClient.addTicketHistory(List.of(
                ticket("H-1", "2024-06-03T09:15:00Z", "Internet", "WiFi", "B-100"),
                ticket("H-2", "2024-06-03T14:30:00Z", "Internet", "Outage", "B-100"),
                ticket("H-3", "2024-06-05T14:45:00Z", "Voice", "Wiring", "B-200")));
        helpdeskClient.addEscalationHistory(List.of(
                EscalationHistoryRecord.builder()
                        .escalationId("HE-1")
                        .ticketId("H-2")
                        .billId("B-100")
                        .entryTime(Instant.parse("2024-06-03T15:00:00Z"))
                        .closeTime(Instant.parse("2024-06-03T21:00:00Z"))
                        .summary("Outage not resolved")
                        .build()));
    }

    @Test
    void analyticsRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/analytics/ticket-volume"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void ticketVolumeForRange() throws Exception {
        mockMvc.perform(get("/api/analytics/ticket-volume")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2024-06-01")
                        .param("end", "2024-06-07"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTickets").value(3))
                .andExpect(jsonPath("$.daysAnalyzed").value(7))
                .andExpect(jsonPath("$.byService[0].service").value("Internet"))
                .andExpect(jsonPath("$.timeline[0].period").value("2024-06-03"));
    }

    @Test
    void escalationMetricsForRange() throws Exception {
        mockMvc.perform(get("/api/analytics/escalation-metrics")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2024-06-01")
                        .param("end", "2024-06-07"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEscalations").value(1))
                .andExpect(jsonPath("$.avgResolutionHours").value(6.0))
                .andExpect(jsonPath("$.resolutionDistribution['4-8h']").value(1));
    }

    @Test
    void timePatternsHonourThroughput() throws Exception {
        mockMvc.perform(get("/api/analytics/time-patterns")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2024-06-01")
                        .param("end", "2024-06-07")
                        .param("throughput", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patterns.busiestHour").value("14:00"))
                .andExpect(jsonPath("$.staffing.ticketsPerStaffHour").value(2.0));
    }

    @Test
    void reversedRangeIsRejected() throws Exception {
        mockMvc.perform(get("/api/analytics/service-health")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2024-06-07")
                        .param("end", "2024-06-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownGranularityIsRejected() throws Exception {
        mockMvc.perform(get("/api/analytics/ticket-volume")
                        .header("X-Auth-Token", TOKEN)
                        .param("granularity", "HOURLY"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void customerPatternsForRange() throws Exception {
        mockMvc.perform(get("/api/analytics/customer-patterns")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2024-06-01")
                        .param("end", "2024-06-07"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalCustomersAnalyzed").value(2))
                .andExpect(jsonPath("$.summary.customersWithEscalations").value(1));
    }

    private static TicketHistoryRecord ticket(String id, String at, String service, String category, String billId) {
        return TicketHistoryRecord.builder()
                .ticketId(id)
                .entryTime(Instant.parse(at))
                .service(service)
                .category(category)
                .billId(billId)
                .description("Customer reported a problem")
                .build();
    }
}
