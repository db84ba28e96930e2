package com.handoff.backend.model;

public enum EscalationStatus {
    OPEN,
    CLOSED;

    public boolean matches(EscalationHistoryRecord escalation) {
        return this == CLOSED ? escalation.isClosed() : !escalation.isClosed();
    }
}
