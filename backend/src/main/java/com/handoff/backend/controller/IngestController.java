package com.handoff.backend.controller;

import com.handoff.backend.dto.HandoffRequest;
import com.handoff.backend.dto.HandoffResponse;
import com.handoff.backend.service.HandoffIngestService;
import com.handoff.backend.service.IdempotentResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ingest")
@RequiredArgsConstructor
@Tag(name = "Ingest")
public class IngestController {

    public static final String REPLAY_HEADER = "Idempotent-Replayed";

    private final HandoffIngestService handoffIngestService;

    @PostMapping("/oa-handoff")
    @Operation(summary = "Accept an agent handoff and find or create its ticket")
    public ResponseEntity<HandoffResponse> handoff(
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody HandoffRequest request) {
        IdempotentResponse<HandoffResponse> response = handoffIngestService.ingest(idempotencyKey, request);
        return ResponseEntity.status(response.statusCode())
                .header(REPLAY_HEADER, String.valueOf(response.replayed()))
                .body(response.body());
    }
}
