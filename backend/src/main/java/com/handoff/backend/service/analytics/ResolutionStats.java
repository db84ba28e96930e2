package com.handoff.backend.service.analytics;

public record ResolutionStats(double mean, double median, double min, double max, double stddev) {
}
