package com.handoff.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

@SpringBootTest(properties = {
        "handoff.security.auth.token=rate-token",
        "handoff.helpdesk.mode=mock",
        "handoff.rate-limit.ingest.limit-per-second=1",
        "handoff.rate-limit.ingest.timeout-ms=0"
})
@AutoConfigureMockMvc
class IngestRateLimitTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void requestsBeyondLimitGetRetryAfter() throws Exception {
        String body = "{\"summary\":\"Router offline\",\"oaKey\":\"rate-limit-key\"}";
        MvcResult rejected = null;
        // a refresh cycle can fall between two requests, so allow a few attempts
        for (int attempt = 0; attempt < 5 && rejected == null; attempt++) {
            MvcResult result = mockMvc.perform(post("/ingest/oa-handoff")
                            .header("X-Auth-Token", "rate-token")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andReturn();
            if (result.getResponse().getStatus() != 200) {
                rejected = result;
            }
        }

        assertThat(rejected).isNotNull();
        assertThat(rejected.getResponse().getStatus()).isEqualTo(429);
        assertThat(rejected.getResponse().getHeader("Retry-After")).isEqualTo("1");
        assertThat(rejected.getResponse().getContentAsString())
                .contains("\"errorCode\":\"RATE_LIMIT_EXCEEDED\"")
                .contains("\"retryAfterSeconds\":1");
    }
}
