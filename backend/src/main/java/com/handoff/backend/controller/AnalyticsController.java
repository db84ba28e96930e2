package com.handoff.backend.controller;

import com.handoff.backend.model.Granularity;
import com.handoff.backend.service.analytics.AnalyticsService;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.CustomerPatternReport;
import com.handoff.backend.service.analytics.EscalationMetricsAnalyzer.EscalationMetricsReport;
import com.handoff.backend.service.analytics.ServiceHealthAnalyzer.ServiceHealthReport;
import com.handoff.backend.service.analytics.TicketVolumeAnalyzer.TicketVolumeReport;
import com.handoff.backend.service.analytics.TimePatternAnalyzer.TimePatternReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/ticket-volume")
    @Operation(summary = "Ticket volume per period with trend and service breakdown")
    public TicketVolumeReport ticketVolume(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "DAILY") Granularity granularity) {
        return analyticsService.ticketVolume(begin, end, granularity);
    }

    @GetMapping("/escalation-metrics")
    @Operation(summary = "Escalation resolution times, repeat customers and slowest resolutions")
    public EscalationMetricsReport escalationMetrics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return analyticsService.escalationMetrics(begin, end);
    }

    @GetMapping("/service-health")
    @Operation(summary = "Health score per service")
    public ServiceHealthReport serviceHealth(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return analyticsService.serviceHealth(begin, end);
    }

    @GetMapping("/time-patterns")
    @Operation(summary = "Hourly and weekday patterns with staffing estimates")
    public TimePatternReport timePatterns(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) Double throughput) {
        return analyticsService.timePatterns(begin, end, throughput);
    }

    @GetMapping("/customer-patterns")
    @Operation(summary = "High-touch customers, issue patterns and description keywords")
    public CustomerPatternReport customerPatterns(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return analyticsService.customerPatterns(begin, end);
    }
}
