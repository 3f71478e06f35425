package com.phillippitts.voicegate.service.cost;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cost row written once per ended session.
 *
 * @param sessionId     owning session (primary key)
 * @param breakdown     priced counters
 * @param errorOccurred whether the client reported an error during the session
 * @param endReason     how the session ended
 * @param recordedAt    when the session was closed
 */
public record CostRecord(
        String sessionId,
        CostBreakdown breakdown,
        boolean errorOccurred,
        String endReason,
        Instant recordedAt
) {
    public CostRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(breakdown, "breakdown");
        Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
