package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.VoiceSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of voice sessions.
 *
 * <p>All methods throw {@link org.springframework.dao.DataAccessException} on store failures.
 * Closing goes through {@link #closeIfActive}, a conditional update that succeeds for exactly one
 * caller; every other close path observes {@code false} and does nothing further.
 */
public interface SessionRegistry {

    void register(VoiceSession session);

    Optional<VoiceSession> find(String sessionId);

    /**
     * Records activity on an active session.
     *
     * @return false when the session is unknown or no longer active
     */
    boolean touch(String sessionId, Instant at);

    /**
     * Moves an active session to {@code ended}.
     *
     * @return true only for the call that performed the transition
     */
    boolean closeIfActive(String sessionId, Instant endedAt, String endReason, long durationSeconds);

    /**
     * Snapshot of active sessions whose last activity is before {@code cutoff}, oldest first.
     */
    List<VoiceSession> findIdleActive(Instant cutoff, int limit);

    /** Active sessions, most recent first. */
    List<VoiceSession> findActive(int limit);

    /**
     * Whether the identity has another active session started after {@code startedAfter}.
     * Such a session owns the identity's admission lock.
     */
    boolean hasNewerActiveSession(String identityKey, String excludingSessionId, Instant startedAfter);

    /** Writes an audit row for a denied attempt of a blocked identity. */
    void recordBlocked(VoiceSession attempt);
}
