package com.handoff.backend.service.analytics;

import com.handoff.backend.config.AnalyticsProperties;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Finds high-touch customers, recurring issue patterns and the most frequent words in ticket descriptions.
 */
@Component
@RequiredArgsConstructor
public class CustomerPatternAnalyzer {

    static final int TOP_CUSTOMERS = 20;
    static final int TOP_PATTERNS = 10;
    static final int RECENT_HISTORY = 5;
    static final int HIGH_VOLUME_TICKETS = 10;
    static final int MIN_KEYWORD_LENGTH = 4;

    static final Set<String> STOP_WORDS = Set.of(
            "the", "is", "at", "which", "on", "a", "an", "and", "or", "but", "in", "with", "to", "for",
            "of", "as", "by", "from", "that", "this", "it", "be", "are", "was", "were", "has", "have", "had");

    private final AnalyticsProperties properties;

    public CustomerPatternReport analyze(List<TicketHistoryRecord> tickets,
                                         List<EscalationHistoryRecord> escalations,
                                         LocalDate begin, LocalDate end) {
        AnalyticsProperties.Customers config = properties.getCustomers();
        ZoneId zone = ZoneId.of(properties.getZone());

        // records without a bill id cannot be attributed to a customer
        Map<String, List<TicketHistoryRecord>> ticketsByCustomer = tickets.stream()
                .filter(ticket -> TicketVolumeAnalyzer.hasCustomer(ticket.billId()))
                .collect(Collectors.groupingBy(TicketHistoryRecord::billId));
        Map<String, List<EscalationHistoryRecord>> escalationsByCustomer = escalations.stream()
                .filter(escalation -> TicketVolumeAnalyzer.hasCustomer(escalation.billId()))
                .collect(Collectors.groupingBy(EscalationHistoryRecord::billId));

        Set<String> customers = new LinkedHashSet<>(ticketsByCustomer.keySet());
        customers.addAll(escalationsByCustomer.keySet());

        List<HighTouchCustomer> highTouch = customers.stream()
                .filter(billId -> ticketsByCustomer.getOrDefault(billId, List.of()).size() >= config.getMinTickets()
                        || escalationsByCustomer.getOrDefault(billId, List.of()).size() >= config.getMinEscalations())
                .map(billId -> highTouchCustomer(billId,
                        ticketsByCustomer.getOrDefault(billId, List.of()),
                        escalationsByCustomer.getOrDefault(billId, List.of()),
                        zone))
                .sorted(Comparator.comparingInt(HighTouchCustomer::priority).reversed()
                        .thenComparing(HighTouchCustomer::billId))
                .limit(TOP_CUSTOMERS)
                .toList();

        List<IssuePattern> patterns = issuePatterns(tickets);
        List<KeywordCount> keywords = topKeywords(tickets.stream().map(TicketHistoryRecord::description).toList(),
                config.getKeywordLimit());

        Summary summary = new Summary(
                ticketsByCustomer.size(),
                highTouch.size(),
                escalationsByCustomer.size(),
                patterns.isEmpty() ? "N/A" : patterns.get(0).pattern()
        );
        return new CustomerPatternReport(
                begin + " to " + end,
                highTouch,
                patterns,
                keywords,
                summary,
                tickets.isEmpty() ? "No ticket data available" : null
        );
    }

    public ActionTier tier(int escalationCount) {
        if (escalationCount >= properties.getCustomers().getUrgentEscalations()) {
            return ActionTier.URGENT;
        }
        if (escalationCount >= properties.getCustomers().getMinEscalations()) {
            return ActionTier.SCHEDULE_CALL;
        }
        return ActionTier.MONITOR;
    }

    /**
     * Lowercases, splits on anything that is not a letter or digit, drops stop words and words of
     * three characters or fewer. Ties are ordered alphabetically.
     */
    public static List<KeywordCount> topKeywords(List<String> descriptions, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (String description : descriptions) {
            if (description == null) {
                continue;
            }
            for (String word : description.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ").split("\\s+")) {
                if (word.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(word)) {
                    counts.merge(word, 1L, Long::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(entry -> new KeywordCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private HighTouchCustomer highTouchCustomer(String billId, List<TicketHistoryRecord> tickets,
                                                List<EscalationHistoryRecord> escalations, ZoneId zone) {
        Map<String, Long> issues = tickets.stream()
                .collect(Collectors.groupingBy(CustomerPatternAnalyzer::issueKey, TreeMap::new, Collectors.counting()));
        String primaryIssue = issues.entrySet().stream()
                .reduce((best, candidate) -> candidate.getValue() > best.getValue() ? candidate : best)
                .map(Map.Entry::getKey)
                .orElse(TicketVolumeAnalyzer.UNKNOWN);

        List<TicketHistoryRecord> chronological = tickets.stream()
                .filter(ticket -> ticket.entryTime() != null)
                .sorted(Comparator.comparing(TicketHistoryRecord::entryTime))
                .toList();
        LocalDate lastContact = chronological.isEmpty()
                ? null
                : chronological.get(chronological.size() - 1).entryTime().atZone(zone).toLocalDate();
        List<HistoryEntry> history = chronological.subList(Math.max(0, chronological.size() - RECENT_HISTORY),
                        chronological.size()).stream()
                .map(ticket -> new HistoryEntry(ticket.entryTime().atZone(zone).toLocalDate(),
                        TicketVolumeAnalyzer.labelOf(ticket.service())))
                .toList();

        ActionTier tier = tier(escalations.size());
        return new HighTouchCustomer(
                billId,
                tickets.size(),
                escalations.size(),
                primaryIssue,
                lastContact,
                tier,
                recommendation(tier, escalations.size(), tickets.size(), primaryIssue),
                history
        );
    }

    private static String recommendation(ActionTier tier, int escalations, int tickets, String primaryIssue) {
        return switch (tier) {
            case URGENT -> "URGENT: " + escalations + " escalations - schedule executive review";
            case SCHEDULE_CALL -> "Schedule proactive call - recurring " + primaryIssue + " issues";
            case MONITOR -> tickets >= HIGH_VOLUME_TICKETS
                    ? "High volume customer - consider account review"
                    : "Monitor for patterns";
        };
    }

    private List<IssuePattern> issuePatterns(List<TicketHistoryRecord> tickets) {
        Map<String, Integer> occurrences = new HashMap<>();
        Map<String, Set<String>> affected = new HashMap<>();
        for (TicketHistoryRecord ticket : tickets) {
            String pattern = TicketVolumeAnalyzer.labelOf(ticket.service()) + " - "
                    + (ticket.category() == null || ticket.category().isBlank() ? "General" : ticket.category());
            occurrences.merge(pattern, 1, Integer::sum);
            Set<String> customers = affected.computeIfAbsent(pattern, key -> new HashSet<>());
            if (ticket.billId() != null && !ticket.billId().isBlank()) {
                customers.add(ticket.billId());
            }
        }
        int systemic = properties.getCustomers().getSystemicCustomerThreshold();
        return occurrences.entrySet().stream()
                .map(entry -> {
                    int customers = affected.get(entry.getKey()).size();
                    boolean isSystemic = customers > systemic;
                    return new IssuePattern(entry.getKey(), customers, entry.getValue(), isSystemic,
                            isSystemic ? "Systemic issue - investigate root cause" : "Monitor trend");
                })
                .sorted(Comparator.comparingInt(IssuePattern::affectedCustomers).reversed()
                        .thenComparing(Comparator.comparingInt(IssuePattern::totalOccurrences).reversed())
                        .thenComparing(IssuePattern::pattern))
                .limit(TOP_PATTERNS)
                .toList();
    }

    private static String issueKey(TicketHistoryRecord ticket) {
        String service = TicketVolumeAnalyzer.labelOf(ticket.service());
        return ticket.category() == null || ticket.category().isBlank()
                ? service
                : service + " - " + ticket.category();
    }

    public enum ActionTier {
        URGENT,
        SCHEDULE_CALL,
        MONITOR
    }

    public record CustomerPatternReport(
            String period,
            List<HighTouchCustomer> highTouchCustomers,
            List<IssuePattern> issuePatterns,
            List<KeywordCount> topKeywords,
            Summary summary,
            String message
    ) {
    }

    public record HighTouchCustomer(
            String billId,
            int totalTickets,
            int totalEscalations,
            String primaryIssue,
            LocalDate lastContact,
            ActionTier action,
            String recommendation,
            List<HistoryEntry> recentTickets
    ) {

        /** Escalations weigh ten tickets. */
        int priority() {
            return totalEscalations * 10 + totalTickets;
        }
    }

    public record HistoryEntry(LocalDate date, String issue) {
    }

    public record IssuePattern(String pattern, int affectedCustomers, int totalOccurrences, boolean systemic,
                               String recommendation) {
    }

    public record KeywordCount(String keyword, long count) {
    }

    public record Summary(int totalCustomersAnalyzed, int highTouchCount, int customersWithEscalations,
                          String mostCommonIssue) {
    }
}
