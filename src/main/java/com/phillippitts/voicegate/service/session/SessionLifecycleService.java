package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.AdmissionDecision;
import com.phillippitts.voicegate.domain.ClientIdentity;
import com.phillippitts.voicegate.domain.EndReason;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.SessionStatus;
import com.phillippitts.voicegate.domain.SessionUsage;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.exception.SessionNotFoundException;
import com.phillippitts.voicegate.exception.SessionStoreException;
import com.phillippitts.voicegate.exception.VoiceGateException;
import com.phillippitts.voicegate.service.broker.CredentialBroker;
import com.phillippitts.voicegate.service.broker.EphemeralSession;
import com.phillippitts.voicegate.service.capture.EventCaptureRouter;
import com.phillippitts.voicegate.service.cost.CostAccountant;
import com.phillippitts.voicegate.service.cost.CostRecord;
import com.phillippitts.voicegate.service.events.StorageFailureEvent;
import com.phillippitts.voicegate.service.limiter.UsageLimiter;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import com.phillippitts.voicegate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Opens and closes voice sessions.
 *
 * <p>{@link #close(String, String, SessionUsage)} is the only way a session ends: explicit client end,
 * janitor timeout, heartbeat orphan cleanup and operator force close all call it. The registry's
 * conditional update picks exactly one winner, so the lock release, cost record and transcript
 * finalization run once per session however many paths race.
 *
 * <p>Lock ownership: when a newer active session of the same identity exists, it owns the admission
 * lock, so closing the older one adds its duration without clearing the lock.
 */
@Service
public class SessionLifecycleService {
    private static final Logger LOG = LogManager.getLogger(SessionLifecycleService.class);

    private final UsageLimiter limiter;
    private final CredentialBroker broker;
    private final SessionRegistry registry;
    private final HeartbeatRegistry heartbeats;
    private final CostAccountant costAccountant;
    private final EventCaptureRouter router;
    private final VoiceSessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SessionLifecycleService(UsageLimiter limiter,
                                   CredentialBroker broker,
                                   SessionRegistry registry,
                                   HeartbeatRegistry heartbeats,
                                   CostAccountant costAccountant,
                                   EventCaptureRouter router,
                                   VoiceSessionMetrics metrics,
                                   ApplicationEventPublisher publisher,
                                   Clock clock) {
        this.limiter = Objects.requireNonNull(limiter);
        this.broker = Objects.requireNonNull(broker);
        this.registry = Objects.requireNonNull(registry);
        this.heartbeats = Objects.requireNonNull(heartbeats);
        this.costAccountant = Objects.requireNonNull(costAccountant);
        this.router = Objects.requireNonNull(router);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Admits the identity, obtains a credential and registers the session.
     *
     * @return denial, or the issued credential
     * @throws com.phillippitts.voicegate.exception.ProviderUnavailableException when the provider is down;
     *         the admission lock is released first
     * @throws com.phillippitts.voicegate.exception.ProviderRequestException when the provider rejected the request
     * @throws SessionStoreException when the session row could not be written
     */
    public OpenResult open(ClientIdentity identity, ModelTier tier, VoiceProfile voice) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(voice, "voice");
        String key = identity.key();

        AdmissionDecision decision = limiter.checkAndAdmit(identity);
        if (!decision.allowed()) {
            if (decision.blocked()) {
                recordBlockedAttempt(key, tier, voice, decision.reason());
            }
            LOG.info("Admission denied for {}: {}", LogSanitizer.maskIdentity(key), decision.reason());
            return OpenResult.denied(decision);
        }

        EphemeralSession session;
        try {
            session = broker.createSession(tier, voice);
        } catch (VoiceGateException e) {
            limiter.endSession(key, 0);
            metrics.recordSessionClosed(EndReason.PROVIDER_FAILURE.code());
            LOG.warn("Released admission of {} after provider failure", LogSanitizer.maskIdentity(key));
            throw e;
        }

        try {
            registry.register(VoiceSession.started(session.sessionId(), key, tier, voice, clock.instant()));
        } catch (DataAccessException e) {
            limiter.endSession(key, 0);
            throw new SessionStoreException("register-session", e);
        }
        LOG.info("Session {} opened for {} ({} credits left today)",
                session.sessionId(), LogSanitizer.maskIdentity(key), decision.remainingCredits());
        return new OpenResult(decision, session);
    }

    private void recordBlockedAttempt(String key, ModelTier tier, VoiceProfile voice, String reason) {
        Instant now = clock.instant();
        VoiceSession attempt = new VoiceSession("blocked_" + UUID.randomUUID().toString().replace("-", ""),
                key, tier, voice, SessionStatus.BLOCKED, now, now, now, EndReason.QUOTA_BLOCKED.code(), 0);
        try {
            registry.recordBlocked(attempt);
        } catch (DataAccessException e) {
            LOG.warn("Could not record blocked attempt for {}: {}", LogSanitizer.maskIdentity(key), e.toString());
        }
        LOG.debug("Blocked attempt recorded: {}", reason);
    }

    /**
     * Ends an active session.
     *
     * <p>Steps, run only by the caller that wins the conditional update:
     * <ol>
     *   <li>charge the duration to the identity and release its lock (unless a newer session owns it)</li>
     *   <li>compute and store the cost record</li>
     *   <li>flush and finalize the transcript, mark the heartbeat row offline</li>
     * </ol>
     *
     * @param sessionId session to end
     * @param reason    end reason code ({@link EndReason#code()} or operator text)
     * @param usage     client-reported counters, or null to infer duration from activity timestamps
     * @return result; {@code closed=false} when the session had already ended
     * @throws SessionNotFoundException when no such session exists
     * @throws SessionStoreException    when the registry is unavailable
     */
    public CloseResult close(String sessionId, String reason, SessionUsage usage) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(reason, "reason");

        VoiceSession session = findOrThrow(sessionId);
        if (!session.isActive()) {
            return CloseResult.alreadyClosed(sessionId, session.endReason());
        }

        SessionUsage effective = usage != null ? usage : SessionUsage.durationOnly(session.inferredDurationSeconds());
        long duration = effective.durationSeconds();
        boolean won;
        try {
            won = registry.closeIfActive(sessionId, clock.instant(), reason, duration);
        } catch (DataAccessException e) {
            throw new SessionStoreException("close-session", e);
        }
        if (!won) {
            LOG.debug("Session {} was closed concurrently", sessionId);
            return CloseResult.alreadyClosed(sessionId, reason);
        }

        chargeIdentity(session, duration);
        CostRecord cost = recordCost(session, effective, reason);
        finalizeCapture(sessionId);

        metrics.recordSessionClosed(reason);
        LOG.info("Session {} closed: reason={}, duration={}s", sessionId, reason, duration);
        return new CloseResult(sessionId, true, duration, reason, cost);
    }

    private void chargeIdentity(VoiceSession session, long duration) {
        String key = session.identityKey();
        boolean newerOwnsLock;
        try {
            newerOwnsLock = registry.hasNewerActiveSession(key, session.sessionId(), session.startedAt());
        } catch (DataAccessException e) {
            LOG.warn("Could not check newer sessions of {}; releasing lock", LogSanitizer.maskIdentity(key));
            newerOwnsLock = false;
        }
        boolean charged = newerOwnsLock
                ? limiter.recordUsage(key, duration)
                : limiter.endSession(key, duration);
        if (!charged) {
            LOG.warn("Duration of session {} was not charged to {}", session.sessionId(),
                    LogSanitizer.maskIdentity(key));
        }
    }

    private CostRecord recordCost(VoiceSession session, SessionUsage usage, String reason) {
        try {
            return costAccountant.recordSessionCost(session.sessionId(), session.modelTier(), usage, reason);
        } catch (DataAccessException e) {
            publisher.publishEvent(new StorageFailureEvent("record-cost", clock.instant(), e.getMessage(), e,
                    Map.of("sessionId", session.sessionId())));
            return null;
        }
    }

    private void finalizeCapture(String sessionId) {
        router.finalizeSession(sessionId);
        try {
            heartbeats.markOffline(sessionId);
        } catch (DataAccessException e) {
            LOG.warn("Could not mark heartbeat of session {} offline: {}", sessionId, e.toString());
        }
    }

    /**
     * Records a heartbeat and activity for an active session.
     *
     * @return false when the session is no longer active
     * @throws SessionNotFoundException when no such session exists
     */
    public boolean heartbeat(String sessionId, String deviceId) {
        Objects.requireNonNull(sessionId, "sessionId");
        VoiceSession session = findOrThrow(sessionId);
        if (!session.isActive()) {
            return false;
        }
        Instant now = clock.instant();
        try {
            heartbeats.upsert(sessionId, deviceId, now);
            return registry.touch(sessionId, now);
        } catch (DataAccessException e) {
            throw new SessionStoreException("heartbeat", e);
        }
    }

    public List<VoiceSession> activeSessions(int limit) {
        try {
            return registry.findActive(limit);
        } catch (DataAccessException e) {
            throw new SessionStoreException("list-active", e);
        }
    }

    private VoiceSession findOrThrow(String sessionId) {
        try {
            return registry.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (DataAccessException e) {
            throw new SessionStoreException("find-session", e);
        }
    }
}
