package com.phillippitts.voicegate.service.janitor;

import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.domain.EndReason;
import com.phillippitts.voicegate.domain.HeartbeatRecord;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.exception.SessionNotFoundException;
import com.phillippitts.voicegate.service.session.CloseResult;
import com.phillippitts.voicegate.service.session.HeartbeatRegistry;
import com.phillippitts.voicegate.service.session.SessionLifecycleService;
import com.phillippitts.voicegate.service.session.SessionLivenessPolicy;
import com.phillippitts.voicegate.service.session.SessionRegistry;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reclaims sessions whose clients went away without ending them.
 *
 * Sweeps, both run from one scheduled tick:
 * - timeout sweep: active sessions idle past the inactivity timeout are closed with
 *   {@code inactivity_timeout};
 * - orphan sweep: online heartbeat rows silent past the heartbeat timeout close their session with
 *   {@code orphaned_cleanup} and are marked offline.
 *
 * Every close goes through {@link SessionLifecycleService#close}, so re-running a sweep or racing a
 * client end is a no-op. Each query takes a bounded snapshot and each run has a time budget; rows
 * left over wait for the next tick. One failing session never stops the rest of the batch.
 *
 * {@code voice.janitor.enabled=false} turns off the scheduled sweeps only; operator force close keeps working.
 */
@Component
public class SessionJanitor {

    private static final Logger LOG = LogManager.getLogger(SessionJanitor.class);

    static final String TIMEOUT_SWEEP = "timeout";
    static final String ORPHAN_SWEEP = "orphan";

    /** Counts of one sweep run. */
    public record SweepReport(String sweep, int examined, int closed, int failed, boolean budgetExhausted) {
    }

    private final SessionLifecycleService lifecycle;
    private final SessionRegistry registry;
    private final HeartbeatRegistry heartbeats;
    private final SessionLivenessPolicy policy;
    private final JanitorProperties props;
    private final VoiceSessionMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastSweepAt;

    public SessionJanitor(SessionLifecycleService lifecycle,
                          SessionRegistry registry,
                          HeartbeatRegistry heartbeats,
                          SessionLivenessPolicy policy,
                          JanitorProperties props,
                          VoiceSessionMetrics metrics,
                          Clock clock) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (props.isEnabled()) {
            LOG.info("Session janitor enabled: inactivity={}s, heartbeat={}s, every {} ms",
                    props.getInactivityTimeoutSeconds(), props.getHeartbeatTimeoutSeconds(), props.getSweepIntervalMs());
        } else {
            LOG.warn("Session janitor sweeps disabled; abandoned sessions keep their locks until force closed");
        }
    }

    @Scheduled(fixedDelayString = "${voice.janitor.sweep-interval-ms:60000}",
            initialDelayString = "${voice.janitor.sweep-interval-ms:60000}")
    void scheduledSweep() {
        if (!props.isEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Previous sweep still running; skipping");
            return;
        }
        try {
            sweepInactive();
            sweepOrphans();
            lastSweepAt = clock.instant();
        } finally {
            running.set(false);
        }
    }

    /**
     * Closes active sessions idle past the inactivity timeout.
     */
    public SweepReport sweepInactive() {
        long t0 = System.nanoTime();
        long deadline = t0 + props.getMaxSweepMillis() * 1_000_000L;
        List<VoiceSession> idle;
        try {
            idle = registry.findIdleActive(policy.inactivityCutoff(clock.instant()), props.getMaxSessionsPerSweep());
        } catch (DataAccessException e) {
            LOG.warn("Timeout sweep could not query sessions: {}", e.toString());
            metrics.recordSweep(TIMEOUT_SWEEP, 0, 1, System.nanoTime() - t0);
            return new SweepReport(TIMEOUT_SWEEP, 0, 0, 1, false);
        }

        int closed = 0;
        int failed = 0;
        int examined = 0;
        boolean exhausted = false;
        for (VoiceSession s : idle) {
            if (System.nanoTime() > deadline) {
                exhausted = true;
                break;
            }
            examined++;
            try {
                if (lifecycle.close(s.sessionId(), EndReason.INACTIVITY_TIMEOUT.code(), null).closed()) {
                    closed++;
                }
            } catch (RuntimeException e) {
                failed++;
                LOG.warn("Timeout sweep failed to close session {}: {}", s.sessionId(), e.toString());
            }
        }
        return finish(TIMEOUT_SWEEP, idle.size(), examined, closed, failed, exhausted, t0);
    }

    /**
     * Closes sessions whose heartbeat went silent and marks their rows offline.
     */
    public SweepReport sweepOrphans() {
        long t0 = System.nanoTime();
        long deadline = t0 + props.getMaxSweepMillis() * 1_000_000L;
        List<HeartbeatRecord> stale;
        try {
            stale = heartbeats.findStaleOnline(policy.heartbeatCutoff(clock.instant()), props.getMaxSessionsPerSweep());
        } catch (DataAccessException e) {
            LOG.warn("Orphan sweep could not query heartbeats: {}", e.toString());
            metrics.recordSweep(ORPHAN_SWEEP, 0, 1, System.nanoTime() - t0);
            return new SweepReport(ORPHAN_SWEEP, 0, 0, 1, false);
        }

        int closed = 0;
        int failed = 0;
        int examined = 0;
        boolean exhausted = false;
        for (HeartbeatRecord hb : stale) {
            if (System.nanoTime() > deadline) {
                exhausted = true;
                break;
            }
            examined++;
            try {
                if (closeOrphan(hb)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                failed++;
                LOG.warn("Orphan sweep failed for session {}: {}", hb.sessionId(), e.toString());
            }
        }
        return finish(ORPHAN_SWEEP, stale.size(), examined, closed, failed, exhausted, t0);
    }

    private boolean closeOrphan(HeartbeatRecord hb) {
        boolean closed;
        try {
            closed = lifecycle.close(hb.sessionId(), EndReason.ORPHANED_CLEANUP.code(), null).closed();
        } catch (SessionNotFoundException e) {
            LOG.debug("Heartbeat row {} has no session", hb.sessionId());
            closed = false;
        }
        if (!closed) {
            // session already ended elsewhere; only the heartbeat row is left online
            heartbeats.markOffline(hb.sessionId());
        }
        return closed;
    }

    private SweepReport finish(String sweep, int found, int examined, int closed, int failed,
                               boolean exhausted, long t0) {
        metrics.recordSweep(sweep, closed, failed, System.nanoTime() - t0);
        if (exhausted) {
            LOG.warn("{} sweep hit its {} ms budget after {} of {} rows", sweep, props.getMaxSweepMillis(),
                    examined, found);
        }
        if (closed > 0 || failed > 0) {
            LOG.info("{} sweep: found={}, closed={}, failed={}", sweep, found, closed, failed);
        }
        return new SweepReport(sweep, examined, closed, failed, exhausted);
    }

    /**
     * Operator close.
     *
     * @throws SessionNotFoundException when no such session exists
     */
    public CloseResult forceCloseSession(String sessionId, String reason) {
        String effective = reason == null || reason.isBlank() ? EndReason.ADMIN_FORCE_CLOSE.code() : reason.strip();
        CloseResult result = lifecycle.close(sessionId, effective, null);
        LOG.info("Force close of session {} (reason={}): closed={}", sessionId, effective, result.closed());
        return result;
    }

    /** Completion time of the last full scheduled run; null before the first. */
    public Instant lastSweepAt() {
        return lastSweepAt;
    }
}
