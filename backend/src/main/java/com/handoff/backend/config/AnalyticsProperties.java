package com.handoff.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
@Validated
public class AnalyticsProperties {

    /** Zone used for hour-of-day and day-of-week bucketing. */
    private String zone = "UTC";
    private Trend trend = new Trend();
    private Escalation escalation = new Escalation();
    private Health health = new Health();
    private Staffing staffing = new Staffing();
    private Customers customers = new Customers();

    @Data
    public static class Trend {
        /** Percent change below which a trend counts as stable. */
        @DecimalMin("0.0")
        private double stableBandPercent = 5.0;
    }

    @Data
    public static class Escalation {
        @Min(1)
        private int repeatThreshold = 2;

        @Min(1)
        private int slowestLimit = 10;
    }

    /**
     * score = 100 - (trendWeight * trendPenalty + escalationWeight * escalationPenalty
     * + resolutionWeight * resolutionPenalty), each penalty on 0..100.
     */
    @Data
    public static class Health {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double trendWeight = 0.2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double escalationWeight = 0.4;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double resolutionWeight = 0.4;

        /** Escalation rate (percent of tickets) that earns the full escalation penalty. */
        @DecimalMin("0.1")
        private double escalationRateCeilingPercent = 25.0;

        /** Mean resolution time that earns the full resolution penalty. */
        @DecimalMin("0.1")
        private double resolutionHoursCeiling = 48.0;

        @Min(0)
        private int healthyThreshold = 80;

        @Min(0)
        private int attentionThreshold = 50;
    }

    @Data
    public static class Staffing {
        @DecimalMin("0.1")
        private double ticketsPerStaffHour = 6.0;

        @DecimalMin("1.0")
        private double peakMultiplier = 1.5;
    }

    @Data
    public static class Customers {
        @Min(1)
        private int minTickets = 5;

        @Min(1)
        private int minEscalations = 2;

        @Min(1)
        private int urgentEscalations = 3;

        @Min(1)
        private int systemicCustomerThreshold = 10;

        @Min(1)
        private int keywordLimit = 20;
    }
}
