package com.handoff.backend.service.analytics;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
