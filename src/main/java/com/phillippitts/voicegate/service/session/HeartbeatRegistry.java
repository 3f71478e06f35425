package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.HeartbeatRecord;

import java.time.Instant;
import java.util.List;

/**
 * Liveness table for long-lived clients that send periodic heartbeats.
 */
public interface HeartbeatRegistry {

    /** Creates or refreshes the row for the session and marks it online. */
    void upsert(String sessionId, String deviceId, Instant at);

    /** Snapshot of online rows last seen before {@code cutoff}, oldest first. */
    List<HeartbeatRecord> findStaleOnline(Instant cutoff, int limit);

    /** @return true when an online row was switched offline */
    boolean markOffline(String sessionId);
}
