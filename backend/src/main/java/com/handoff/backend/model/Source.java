package com.handoff.backend.model;

/**
 * Automated system that produced a handoff.
 */
public enum Source {
    ATOM,
    OutageAgent,
    Other
}
