package com.phillippitts.voicegate.service.limiter;

import com.phillippitts.voicegate.domain.AdmissionDecision;
import com.phillippitts.voicegate.domain.ClientIdentity;

import java.util.Optional;

/**
 * Per-identity gate deciding whether a new voice session may start.
 *
 * <p>Quota is counted in credits: accumulated session seconds divided by the credit unit,
 * rounded up. An identity holds at most one admission lock; the lock is taken on admission and
 * released by {@link #endSession(String, long)}.
 *
 * <p>Implementations fail closed: a store error or an overrun of the admission deadline yields a
 * denial unless the allow-on-error override is set. No method throws for store failures.
 */
public interface UsageLimiter {

    /**
     * Evaluates and, when allowed, records a new admission for the identity.
     *
     * @param identity client identity (never null)
     * @return decision with remaining daily credits or a denial reason
     */
    AdmissionDecision checkAndAdmit(ClientIdentity identity);

    /**
     * Adds the session duration to the daily and lifetime counters and clears the lock.
     *
     * <p>Safe to repeat for lock release. Callers must report a given duration once.
     *
     * @param identityKey     {@link ClientIdentity#key()} of the owner
     * @param durationSeconds consumed seconds, negative values are treated as 0
     * @return false when the identity is unknown or the store failed
     */
    boolean endSession(String identityKey, long durationSeconds);

    /**
     * Adds duration without touching the lock. Used when a newer session of the same identity
     * already holds it.
     */
    boolean recordUsage(String identityKey, long durationSeconds);

    Optional<UsageStatus> getStatus(String identityKey);

    /**
     * Lifts a permanent block. Counters are left unchanged.
     *
     * @return false when the identity is unknown or the store failed
     */
    boolean unblock(String identityKey);
}
