package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.exception.ValidationException;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.Granularity;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.analytics.CustomerPatternAnalyzer.CustomerPatternReport;
import com.handoff.backend.service.analytics.EscalationMetricsAnalyzer.EscalationMetricsReport;
import com.handoff.backend.service.analytics.ServiceHealthAnalyzer.ServiceHealthReport;
import com.handoff.backend.service.analytics.TicketVolumeAnalyzer.TicketVolumeReport;
import com.handoff.backend.service.analytics.TimePatternAnalyzer.TimePatternReport;
import com.handoff.backend.service.helpdesk.HelpdeskRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Fetches history for the requested range and hands it to an analyzer. Nothing is cached between requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    static final int DEFAULT_DAYS_BACK = 30;
    static final int MAX_RANGE_DAYS = 366;

    private final HelpdeskRecordSource recordSource;
    private final TicketVolumeAnalyzer ticketVolumeAnalyzer;
    private final EscalationMetricsAnalyzer escalationMetricsAnalyzer;
    private final ServiceHealthAnalyzer serviceHealthAnalyzer;
    private final TimePatternAnalyzer timePatternAnalyzer;
    private final CustomerPatternAnalyzer customerPatternAnalyzer;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public TicketVolumeReport ticketVolume(LocalDate begin, LocalDate end, Granularity granularity) {
        DateRange range = resolve(begin, end);
        List<TicketHistoryRecord> tickets = recordSource.fetchTickets(range.begin(), range.end());
        TicketVolumeReport report = ticketVolumeAnalyzer.analyze(tickets, range.begin(), range.end(), granularity);
        log.info("Ticket volume analysis complete range={} tickets={} services={}",
                range, report.totalTickets(), report.byService().size());
        return report;
    }

    public EscalationMetricsReport escalationMetrics(LocalDate begin, LocalDate end) {
        DateRange range = resolve(begin, end);
        List<EscalationHistoryRecord> escalations = recordSource.fetchEscalations(range.begin(), range.end());
        EscalationMetricsReport report = escalationMetricsAnalyzer.analyze(escalations, range.begin(), range.end());
        log.info("Escalation metrics complete range={} escalations={} repeatCustomers={}",
                range, report.totalEscalations(), report.repeatCustomers().size());
        return report;
    }

    public ServiceHealthReport serviceHealth(LocalDate begin, LocalDate end) {
        DateRange range = resolve(begin, end);
        List<TicketHistoryRecord> tickets = recordSource.fetchTickets(range.begin(), range.end());
        List<EscalationHistoryRecord> escalations = recordSource.fetchEscalations(range.begin(), range.end());
        ServiceHealthReport report = serviceHealthAnalyzer.analyze(tickets, escalations, range.begin(), range.end());
        log.info("Service health complete range={} overall={} critical={}",
                range, report.overallHealthScore(), report.summary().criticalServices());
        return report;
    }

    public TimePatternReport timePatterns(LocalDate begin, LocalDate end, Double throughput) {
        if (throughput != null && throughput <= 0) {
            throw ValidationException.forField("throughput", throughput, "must be greater than 0");
        }
        DateRange range = resolve(begin, end);
        List<TicketHistoryRecord> tickets = recordSource.fetchTickets(range.begin(), range.end());
        TimePatternReport report = timePatternAnalyzer.analyze(tickets, range.begin(), range.end(), throughput);
        log.info("Time pattern analysis complete range={} tickets={} busiestHour={}",
                range, report.totalTickets(), report.patterns().busiestHour());
        return report;
    }

    public CustomerPatternReport customerPatterns(LocalDate begin, LocalDate end) {
        DateRange range = resolve(begin, end);
        List<TicketHistoryRecord> tickets = recordSource.fetchTickets(range.begin(), range.end());
        List<EscalationHistoryRecord> escalations = recordSource.fetchEscalations(range.begin(), range.end());
        CustomerPatternReport report = customerPatternAnalyzer.analyze(tickets, escalations, range.begin(), range.end());
        log.info("Customer pattern analysis complete range={} customers={} highTouch={}",
                range, report.summary().totalCustomersAnalyzed(), report.summary().highTouchCount());
        return report;
    }

    /**
     * Missing end means today in the analytics zone; missing begin means {@value #DEFAULT_DAYS_BACK} days before end.
     */
    DateRange resolve(LocalDate begin, LocalDate end) {
        LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock.withZone(ZoneId.of(properties.getZone())));
        LocalDate effectiveBegin = begin != null ? begin : effectiveEnd.minusDays(DEFAULT_DAYS_BACK);
        if (effectiveBegin.isAfter(effectiveEnd)) {
            throw ValidationException.forField("begin", effectiveBegin.toString(), "must not be after end " + effectiveEnd);
        }
        if (ChronoUnit.DAYS.between(effectiveBegin, effectiveEnd) > MAX_RANGE_DAYS) {
            throw ValidationException.forField("begin", effectiveBegin.toString(),
                    "range must not exceed " + MAX_RANGE_DAYS + " days");
        }
        return new DateRange(effectiveBegin, effectiveEnd);
    }

    record DateRange(LocalDate begin, LocalDate end) {

        @Override
        public String toString() {
            return begin + ".." + end;
        }
    }
}
