package com.phillippitts.voicegate.service.cost;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for per-session cost records. Rows are never updated.
 */
public interface CostRecordStore {

    /**
     * Writes the record unless one already exists for the session.
     *
     * @return true when this call wrote the row
     */
    boolean insertIfAbsent(CostRecord record);

    Optional<CostRecord> find(String sessionId);

    /** Records with {@code from <= recordedAt < to}. */
    List<CostRecord> findRecordedBetween(Instant from, Instant to);
}
