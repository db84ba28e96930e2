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
class HistoryControllerTest {

    private static final String TOKEN = "test-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryHelpdeskClient helpdeskClient;

    @BeforeAll
    void seedHistory() {
        helpdeskClient.addTicketHistory(List.of(
                ticket("S-1", "2023-02-06T09:00:00Z", "B-300"),
                ticket("S-2", "2023-02-07T11:00:00Z", "B-300"),
                ticket("S-3", "2023-02-08T13:00:00Z", "B-400")));
        helpdeskClient.addEscalationHistory(List.of(
                EscalationHistoryRecord.builder()
                        .escalationId("SE-1")
                        .ticketId("S-1")
                        .billId("B-300")
                        .entryTime(Instant.parse("2023-02-06T10:00:00Z"))
                        .closeTime(Instant.parse("2023-02-06T12:00:00Z"))
                        .summary("Modem replaced")
                        .build(),
                EscalationHistoryRecord.builder()
                        .escalationId("SE-2")
                        .ticketId("S-3")
                        .billId("B-400")
                        .entryTime(Instant.parse("2023-02-08T14:00:00Z"))
                        .summary("Line noise")
                        .build()));
    }

    @Test
    void ticketSearchIsNewestFirst() throws Exception {
        mockMvc.perform(get("/api/history/tickets")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2023-02-01")
                        .param("end", "2023-02-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.period").value("2023-02-01..2023-02-10"))
                .andExpect(jsonPath("$.tickets[0].ticketId").value("S-3"));
    }

    @Test
    void ticketSearchFiltersByCustomer() throws Exception {
        mockMvc.perform(get("/api/history/tickets")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2023-02-01")
                        .param("end", "2023-02-10")
                        .param("billId", "B-300"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.billId").value("B-300"));
    }

    @Test
    void escalationListFiltersByStatus() throws Exception {
        mockMvc.perform(get("/api/history/escalations")
                        .header("X-Auth-Token", TOKEN)
                        .param("begin", "2023-02-01")
                        .param("end", "2023-02-10")
                        .param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.escalations[0].escalationId").value("SE-2"));
    }

    @Test
    void escalationIsFetchedById() throws Exception {
        mockMvc.perform(get("/api/history/escalations/SE-1").header("X-Auth-Token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticketId").value("S-1"))
                .andExpect(jsonPath("$.summary").value("Modem replaced"));
    }

    @Test
    void unknownEscalationIsNotFound() throws Exception {
        mockMvc.perform(get("/api/history/escalations/SE-404").header("X-Auth-Token", TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details[0].value").value("SE-404"));
    }

    @Test
    void historyRequiresAuthentication() throws Exception {
        mockMvc.perform(get("/api/history/tickets"))
                .andExpect(status().isUnauthorized());
    }

    private static TicketHistoryRecord ticket(String id, String at, String billId) {
        return TicketHistoryRecord.builder()
                .ticketId(id)
                .entryTime(Instant.parse(at))
                .service("Internet")
                .category("WiFi")
                .billId(billId)
                .description("Intermittent drops")
                .build();
    }
}
