package com.phillippitts.voicegate.service.limiter;

import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.domain.AdmissionDecision;
import com.phillippitts.voicegate.domain.AdmissionRecord;
import com.phillippitts.voicegate.domain.ClientIdentity;
import com.phillippitts.voicegate.service.events.StorageFailureEvent;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import com.phillippitts.voicegate.service.session.SessionLivenessPolicy;
import com.phillippitts.voicegate.service.session.SessionLivenessPolicy.LockState;
import com.phillippitts.voicegate.util.LogSanitizer;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Store-backed usage limiter.
 *
 * <p>Each admission runs as one transaction on the {@code storageExecutor} pool and is awaited
 * for at most {@code voice.limiter.admission-timeout-ms}. The admission record is read with a row
 * lock, so two concurrent checks for one identity serialize on the store.
 *
 * <p><b>Evaluation order:</b>
 * <ol>
 *   <li>No record: insert a first-visit row (lock held) and admit with one credit debited</li>
 *   <li>Blocked: deny, regardless of credits</li>
 *   <li>Lock held: release it, whether recent or orphaned (see {@link SessionLivenessPolicy})</li>
 *   <li>Roll the daily counter if the stored reset date is not today</li>
 *   <li>Daily credits exhausted: deny with the next-midnight reset hint</li>
 *   <li>Lifetime credits exhausted: deny and block permanently</li>
 *   <li>Otherwise admit, take the lock, bump session counters</li>
 * </ol>
 *
 * <p><b>Fail closed:</b> a store error, a rejected task or a deadline overrun returns a denial
 * (or an admission when {@code allow-on-error} is set). Nothing is thrown to the caller.
 *
 * @see UsageLimitProperties
 */
@Service
public class DefaultUsageLimiter implements UsageLimiter {
    private static final Logger LOG = LogManager.getLogger(DefaultUsageLimiter.class);

    static final String SYSTEM_ERROR_REASON = "System error, please retry in a few moments";

    private final AdmissionStore store;
    private final TransactionOperations tx;
    private final Executor executor;
    private final UsageLimitProperties props;
    private final SessionLivenessPolicy liveness;
    private final Clock clock;
    private final VoiceSessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final ZoneId zone;

    public DefaultUsageLimiter(AdmissionStore store,
                               TransactionOperations tx,
                               @Qualifier("storageExecutor") Executor executor,
                               UsageLimitProperties props,
                               SessionLivenessPolicy liveness,
                               Clock clock,
                               VoiceSessionMetrics metrics,
                               ApplicationEventPublisher publisher) {
        this.store = Objects.requireNonNull(store);
        this.tx = Objects.requireNonNull(tx);
        this.executor = Objects.requireNonNull(executor);
        this.props = Objects.requireNonNull(props);
        this.liveness = Objects.requireNonNull(liveness);
        this.clock = Objects.requireNonNull(clock);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.zone = ZoneId.of(props.getZone());
    }

    @Override
    public AdmissionDecision checkAndAdmit(ClientIdentity identity) {
        Objects.requireNonNull(identity, "identity");
        String key = identity.key();
        Instant now = clock.instant();

        CompletableFuture<AdmissionDecision> future;
        try {
            future = CompletableFuture.supplyAsync(() -> evaluateWithRetry(key, now), executor);
        } catch (RuntimeException e) {
            // storage pool saturated
            return failClosed(key, "admission-submit", e);
        }

        try {
            AdmissionDecision decision = future.get(props.getAdmissionTimeoutMs(), TimeUnit.MILLISECONDS);
            metrics.recordAdmission(outcomeOf(decision));
            return decision;
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("Admission check timed out after {} ms for {}",
                    props.getAdmissionTimeoutMs(), LogSanitizer.maskIdentity(key));
            return failClosed(key, "admission-timeout", te);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return failClosed(key, "admission-interrupted", ie);
        } catch (ExecutionException ee) {
            return failClosed(key, "admission", ee.getCause() != null ? ee.getCause() : ee);
        }
    }

    private AdmissionDecision evaluateWithRetry(String key, Instant now) {
        try {
            return tx.execute(status -> evaluate(key, now));
        } catch (DuplicateKeyException race) {
            // Concurrent first visit inserted the row; the second pass sees it under lock
            LOG.debug("First-visit race for {}, re-evaluating", LogSanitizer.maskIdentity(key));
            return tx.execute(status -> evaluate(key, now));
        }
    }

    private AdmissionDecision evaluate(String key, Instant now) {
        LocalDate today = TimeUtils.dayOf(now, zone);
        Optional<AdmissionRecord> existing = store.findForUpdate(key);

        if (existing.isEmpty()) {
            store.insert(AdmissionRecord.firstVisit(key, today, now));
            LOG.info("First admission for {}", LogSanitizer.maskIdentity(key));
            return AdmissionDecision.admit(props.getDailyCreditLimit() - 1);
        }

        AdmissionRecord record = existing.get();
        if (record.blocked()) {
            String reason = record.blockedReason() != null
                    ? record.blockedReason()
                    : "Identity blocked for excessive usage";
            return AdmissionDecision.blocked(reason);
        }

        LockState lock = liveness.classifyLock(record, now);
        if (lock != LockState.FREE) {
            if (lock == LockState.ORPHANED) {
                LOG.info("Releasing orphaned admission lock for {}", LogSanitizer.maskIdentity(key));
            } else {
                LOG.warn("Releasing recent admission lock for {} (held less than {}s)",
                        LogSanitizer.maskIdentity(key), liveness.lockGrace().toSeconds());
            }
            record = record.withLock(false);
        }

        record = record.rolledOver(today);

        long unit = props.getCreditUnitSeconds();
        long dailyUsed = TimeUtils.ceilUnits(record.dailyDurationSeconds(), unit);
        long lifetimeUsed = TimeUtils.ceilUnits(record.lifetimeDurationSeconds(), unit);

        if (dailyUsed >= props.getDailyCreditLimit()) {
            store.update(record);
            return AdmissionDecision.dailyLimit(
                    "Daily limit reached (" + props.getDailyCreditLimit() + " minutes per day)",
                    TimeUtils.nextMidnight(now, zone));
        }

        if (lifetimeUsed >= props.getLifetimeCreditLimit()) {
            String reason = "Total limit reached (" + props.getLifetimeCreditLimit() + " minutes)";
            if (props.isBlockAfterLifetimeLimit()) {
                store.update(record.withBlock(reason));
                LOG.warn("Blocking {} after lifetime limit", LogSanitizer.maskIdentity(key));
                return AdmissionDecision.blocked(reason);
            }
            store.update(record);
            return AdmissionDecision.deny(reason);
        }

        store.update(record.admitted(now));
        return AdmissionDecision.admit((int) (props.getDailyCreditLimit() - dailyUsed));
    }

    @Override
    public boolean endSession(String identityKey, long durationSeconds) {
        return applyDuration(identityKey, durationSeconds, true);
    }

    @Override
    public boolean recordUsage(String identityKey, long durationSeconds) {
        return applyDuration(identityKey, durationSeconds, false);
    }

    private boolean applyDuration(String identityKey, long durationSeconds, boolean releaseLock) {
        Objects.requireNonNull(identityKey, "identityKey");
        long seconds = Math.max(0, durationSeconds);
        LocalDate today = TimeUtils.dayOf(clock.instant(), zone);
        try {
            Boolean applied = tx.execute(status -> {
                Optional<AdmissionRecord> existing = store.findForUpdate(identityKey);
                if (existing.isEmpty()) {
                    return false;
                }
                AdmissionRecord updated = existing.get().rolledOver(today).plusDuration(seconds);
                store.update(releaseLock ? updated.withLock(false) : updated);
                return true;
            });
            if (Boolean.TRUE.equals(applied)) {
                LOG.debug("Recorded {}s for {} (lockReleased={})",
                        seconds, LogSanitizer.maskIdentity(identityKey), releaseLock);
                return true;
            }
            LOG.warn("No admission record for {}", LogSanitizer.maskIdentity(identityKey));
            return false;
        } catch (DataAccessException e) {
            publishFailure(releaseLock ? "end-session" : "record-usage", identityKey, e);
            if (releaseLock) {
                releaseLockAfterFailure(identityKey);
            }
            return false;
        }
    }

    private void releaseLockAfterFailure(String identityKey) {
        try {
            store.releaseLock(identityKey);
        } catch (DataAccessException e) {
            LOG.error("Lock release also failed for {}; the next admission will release it",
                    LogSanitizer.maskIdentity(identityKey), e);
        }
    }

    @Override
    public Optional<UsageStatus> getStatus(String identityKey) {
        Objects.requireNonNull(identityKey, "identityKey");
        Optional<AdmissionRecord> found;
        try {
            found = store.find(identityKey);
        } catch (DataAccessException e) {
            publishFailure("status", identityKey, e);
            return Optional.empty();
        }
        Instant now = clock.instant();
        return found.map(r -> toStatus(r.rolledOver(TimeUtils.dayOf(now, zone)), now));
    }

    private UsageStatus toStatus(AdmissionRecord r, Instant now) {
        long unit = props.getCreditUnitSeconds();
        long dailyUsed = TimeUtils.ceilUnits(r.dailyDurationSeconds(), unit);
        long lifetimeUsed = TimeUtils.ceilUnits(r.lifetimeDurationSeconds(), unit);
        return new UsageStatus(
                r.identityKey(),
                dailyUsed,
                Math.max(0, props.getDailyCreditLimit() - dailyUsed),
                lifetimeUsed,
                Math.max(0, props.getLifetimeCreditLimit() - lifetimeUsed),
                r.sessionCount(),
                r.activeLock(),
                r.blocked(),
                r.blockedReason(),
                TimeUtils.nextMidnight(now, zone));
    }

    @Override
    public boolean unblock(String identityKey) {
        Objects.requireNonNull(identityKey, "identityKey");
        try {
            Boolean done = tx.execute(status -> {
                Optional<AdmissionRecord> existing = store.findForUpdate(identityKey);
                existing.ifPresent(r -> store.update(r.unblocked()));
                return existing.isPresent();
            });
            if (Boolean.TRUE.equals(done)) {
                LOG.info("Unblocked {}", LogSanitizer.maskIdentity(identityKey));
                return true;
            }
            return false;
        } catch (DataAccessException e) {
            publishFailure("unblock", identityKey, e);
            return false;
        }
    }

    private AdmissionDecision failClosed(String key, String operation, Throwable cause) {
        publishFailure(operation, key, cause);
        metrics.recordAdmission("error");
        return new AdmissionDecision(props.isAllowOnError(), 0, SYSTEM_ERROR_REASON, null, false);
    }

    private void publishFailure(String operation, String identityKey, Throwable cause) {
        LOG.warn("Limiter operation '{}' failed for {}: {}",
                operation, LogSanitizer.maskIdentity(identityKey), cause.toString());
        publisher.publishEvent(new StorageFailureEvent(operation, clock.instant(), cause.getMessage(), cause,
                Map.of("identity", LogSanitizer.maskIdentity(identityKey))));
    }

    private static String outcomeOf(AdmissionDecision d) {
        if (d.allowed()) {
            return "admitted";
        }
        if (d.blocked()) {
            return "blocked";
        }
        return d.resetAt() != null ? "daily_limit" : "denied";
    }
}
