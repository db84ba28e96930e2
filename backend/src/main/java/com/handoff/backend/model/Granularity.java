package com.handoff.backend.model;

public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY
}
