package com.handoff.backend.service;

import com.handoff.backend.model.IdempotencyRecord;

/**
 * Result of looking up an idempotency key.
 *
 * @param stored the record found for the key, null on {@link Outcome#MISS}
 */
public record IdempotencyCheck(Outcome outcome, IdempotencyRecord stored) {

    public enum Outcome {
        /** Key seen with the same payload and a completed response. */
        HIT,
        /** Key unknown or expired. */
        MISS,
        /** Key seen with a different payload. */
        CONFLICT,
        /** Key seen with the same payload, still being processed. */
        IN_PROGRESS
    }

    static IdempotencyCheck miss() {
        return new IdempotencyCheck(Outcome.MISS, null);
    }
}
