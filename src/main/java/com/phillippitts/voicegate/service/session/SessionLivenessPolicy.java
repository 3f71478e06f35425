package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.domain.AdmissionRecord;
import com.phillippitts.voicegate.domain.VoiceSession;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Single source of the liveness windows used by admission and by the janitor.
 *
 * <p>Two horizons exist and they do not compete:
 * <ul>
 *   <li><b>Lock grace</b> (default 30 s): only classifies a held admission lock when the same
 *       identity asks for a new session. The limiter releases the lock in both cases; the
 *       classification is reported for diagnostics.</li>
 *   <li><b>Inactivity</b> (default 30 min) and <b>heartbeat</b> (default 15 min): decide when the
 *       janitor closes a session row. Only the janitor ends sessions on elapsed time.</li>
 * </ul>
 *
 * <p>A session 31 seconds old therefore loses its lock to a new admission of the same identity but
 * keeps its row active until it is ended or 30 minutes pass without activity.
 */
@Component
public class SessionLivenessPolicy {

    /** How a held lock looks to a new admission attempt. */
    public enum LockState {
        FREE,
        /** Held, last admission within the grace window (double click, fast reload). */
        RECENT,
        /** Held, last admission older than the grace window (tab closed without signalling). */
        ORPHANED
    }

    private final Duration lockGrace;
    private final Duration inactivityTimeout;
    private final Duration heartbeatTimeout;

    @Autowired
    public SessionLivenessPolicy(UsageLimitProperties limits, JanitorProperties janitor) {
        this(Duration.ofSeconds(limits.getStaleLockGraceSeconds()),
                Duration.ofSeconds(janitor.getInactivityTimeoutSeconds()),
                Duration.ofSeconds(janitor.getHeartbeatTimeoutSeconds()));
    }

    public SessionLivenessPolicy(Duration lockGrace, Duration inactivityTimeout, Duration heartbeatTimeout) {
        this.lockGrace = Objects.requireNonNull(lockGrace, "lockGrace");
        this.inactivityTimeout = Objects.requireNonNull(inactivityTimeout, "inactivityTimeout");
        this.heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
    }

    public LockState classifyLock(AdmissionRecord record, Instant now) {
        if (!record.activeLock()) {
            return LockState.FREE;
        }
        Duration held = Duration.between(record.lastSessionAt(), now);
        return held.compareTo(lockGrace) > 0 ? LockState.ORPHANED : LockState.RECENT;
    }

    /** Sessions whose last activity is before this instant are due for an inactivity close. */
    public Instant inactivityCutoff(Instant now) {
        return now.minus(inactivityTimeout);
    }

    /** Online heartbeat rows last seen before this instant are orphaned. */
    public Instant heartbeatCutoff(Instant now) {
        return now.minus(heartbeatTimeout);
    }

    public boolean isInactive(VoiceSession session, Instant now) {
        return session.isActive() && session.lastActivityAt().isBefore(inactivityCutoff(now));
    }

    public Duration lockGrace() {
        return lockGrace;
    }
}
