package com.phillippitts.voicegate.service.conversation;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.service.events.StorageFailureEvent;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers conversation turns in memory and writes them in batches.
 *
 * <p><b>Numbering:</b> {@link #logTurn(TurnEntry)} assigns the turn number from a per-session
 * counter under the queue lock, so numbers follow acceptance order and are 1..N without gaps.
 * A counter is seeded from {@link TurnStore#maxTurnNumber(String)} the first time a session is seen,
 * so numbering continues after a restart instead of colliding with stored turns.
 *
 * <p><b>Flush triggers:</b> the queue reaching {@code voice.conversation.max-batch-size} (handed to
 * {@code flushExecutor}) or the fixed-delay timer, whichever comes first.
 *
 * <p><b>Flush algorithm:</b> swap the queue for an empty one, write the swapped batch once, and on
 * failure put the batch back in front of anything queued meanwhile with its attempt count bumped.
 * There is no inner retry loop; the next trigger retries. Flushes are serialized, so a turn is never
 * in two batches at once.
 *
 * <p>Once a batch has failed {@code voice.conversation.max-flush-attempts} times it is written turn by
 * turn. Turns the store refuses as constraint violations are set aside and counted; any other failure
 * requeues the remainder.
 *
 * <p>Counters are process-local. Instances writing the same session concurrently are not supported.
 */
@Service
public class ConversationLogger {
    private static final Logger LOG = LogManager.getLogger(ConversationLogger.class);

    /** Finalized sessions remembered so late events cannot restart numbering at 1. */
    private static final int FINALIZED_MEMORY = 10_000;

    /** A queued turn and how many writes of it have already failed. */
    record QueuedTurn(ConversationTurn turn, int failedAttempts) {
    }

    private final TurnStore store;
    private final Executor flushExecutor;
    private final ConversationLogProperties props;
    private final VoiceSessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Object queueLock = new Object();
    private final Object flushLock = new Object();
    private Deque<QueuedTurn> pending = new ArrayDeque<>();
    private final Map<String, Integer> turnCounters = new HashMap<>();
    private final Map<String, Boolean> finalized = new LinkedHashMap<>(256, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > FINALIZED_MEMORY;
        }
    };

    private final AtomicLong setAsideTurns = new AtomicLong();

    private volatile Instant lastSuccessfulFlushAt;
    private volatile Instant lastFailedFlushAt;

    public ConversationLogger(TurnStore store,
                              @Qualifier("flushExecutor") Executor flushExecutor,
                              ConversationLogProperties props,
                              VoiceSessionMetrics metrics,
                              ApplicationEventPublisher publisher,
                              Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.flushExecutor = Objects.requireNonNull(flushExecutor);
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Numbers and queues a turn.
     *
     * @param entry turn to log
     * @return the numbered turn, or null when the session was already finalized
     */
    public ConversationTurn logTurn(TurnEntry entry) {
        Objects.requireNonNull(entry, "entry");
        String sessionId = entry.sessionId();
        boolean counted;
        synchronized (queueLock) {
            if (finalized.containsKey(sessionId)) {
                LOG.debug("Rejecting turn for finalized session {}", sessionId);
                return null;
            }
            counted = turnCounters.containsKey(sessionId);
        }
        int stored = counted ? 0 : storedTurnNumber(sessionId);

        ConversationTurn turn;
        int queued;
        synchronized (queueLock) {
            if (finalized.containsKey(sessionId)) {
                LOG.debug("Rejecting turn for finalized session {}", sessionId);
                return null;
            }
            if (!turnCounters.containsKey(sessionId)) {
                turnCounters.put(sessionId, Math.max(stored, pendingTurnNumber(sessionId)));
            }
            int number = turnCounters.merge(sessionId, 1, Integer::sum);
            turn = entry.numbered(number);
            pending.addLast(new QueuedTurn(turn, 0));
            queued = pending.size();
        }
        if (queued >= props.getMaxBatchSize()) {
            triggerFlush();
        }
        if (queued >= props.getBacklogWarnThreshold()) {
            LOG.warn("Conversation backlog at {} turns; store may be unavailable", queued);
        }
        return turn;
    }

    private int storedTurnNumber(String sessionId) {
        try {
            return store.maxTurnNumber(sessionId);
        } catch (DataAccessException e) {
            LOG.warn("Could not read last turn number of session {}; numbering from queued turns: {}",
                    sessionId, e.toString());
            return 0;
        }
    }

    /** Caller holds the queue lock. */
    private int pendingTurnNumber(String sessionId) {
        int max = 0;
        for (QueuedTurn q : pending) {
            if (q.turn().sessionId().equals(sessionId)) {
                max = Math.max(max, q.turn().turnNumber());
            }
        }
        return max;
    }

    private void triggerFlush() {
        try {
            flushExecutor.execute(this::flush);
        } catch (RejectedExecutionException e) {
            LOG.debug("Flush trigger rejected; timer will pick up the batch");
        }
    }

    @Scheduled(fixedDelayString = "${voice.conversation.flush-interval-ms:2000}",
            initialDelayString = "${voice.conversation.flush-interval-ms:2000}")
    void scheduledFlush() {
        flush();
    }

    /**
     * Writes everything queued so far in one batch.
     *
     * @return number of turns persisted by this call (0 on failure or empty queue)
     */
    public int flush() {
        synchronized (flushLock) {
            List<QueuedTurn> batch;
            synchronized (queueLock) {
                if (pending.isEmpty()) {
                    return 0;
                }
                batch = new ArrayList<>(pending);
                pending = new ArrayDeque<>();
            }

            if (maxFailedAttempts(batch) >= props.getMaxFlushAttempts()) {
                return flushTurnByTurn(batch);
            }

            List<ConversationTurn> turns = new ArrayList<>(batch.size());
            for (QueuedTurn q : batch) {
                turns.add(q.turn());
            }

            long t0 = System.nanoTime();
            try {
                store.saveAll(turns);
                lastSuccessfulFlushAt = clock.instant();
                metrics.recordFlush(turns.size(), System.nanoTime() - t0);
                LOG.debug("Flushed {} conversation turns", turns.size());
                return turns.size();
            } catch (RuntimeException e) {
                failed(batch, e);
                return 0;
            }
        }
    }

    /** Caller holds the flush lock. */
    private int flushTurnByTurn(List<QueuedTurn> batch) {
        long t0 = System.nanoTime();
        int persisted = 0;
        int setAside = 0;
        DataIntegrityViolationException refusal = null;
        for (int i = 0; i < batch.size(); i++) {
            QueuedTurn q = batch.get(i);
            try {
                store.saveAll(List.of(q.turn()));
                persisted++;
            } catch (DataIntegrityViolationException e) {
                setAside++;
                refusal = e;
                LOG.error("Setting aside turn {} of session {} after {} failed flushes: {}",
                        q.turn().turnNumber(), q.turn().sessionId(), q.failedAttempts(), e.toString());
            } catch (RuntimeException e) {
                failed(new ArrayList<>(batch.subList(i, batch.size())), e);
                break;
            }
        }

        if (persisted > 0) {
            lastSuccessfulFlushAt = clock.instant();
            metrics.recordFlush(persisted, System.nanoTime() - t0);
            LOG.info("Flushed {} conversation turns one by one", persisted);
        }
        if (setAside > 0) {
            setAsideTurns.addAndGet(setAside);
            metrics.incrementTurnsSetAside(setAside);
            publisher.publishEvent(new StorageFailureEvent("set-aside-turns", clock.instant(),
                    "Store refused " + setAside + " turns", refusal, Map.of("turns", String.valueOf(setAside))));
        }
        return persisted;
    }

    private void failed(List<QueuedTurn> batch, RuntimeException e) {
        requeue(batch);
        lastFailedFlushAt = clock.instant();
        metrics.incrementFlushFailure(batch.size());
        int attempts = maxFailedAttempts(batch) + 1;
        LOG.warn("Flush of {} turns failed (attempt {}); batch requeued: {}",
                batch.size(), attempts, e.toString());
        publisher.publishEvent(new StorageFailureEvent("flush-turns", clock.instant(), e.getMessage(), e,
                Map.of("batchSize", String.valueOf(batch.size()), "attempt", String.valueOf(attempts))));
    }

    private static int maxFailedAttempts(Iterable<QueuedTurn> turns) {
        int max = 0;
        for (QueuedTurn q : turns) {
            max = Math.max(max, q.failedAttempts());
        }
        return max;
    }

    private void requeue(List<QueuedTurn> batch) {
        synchronized (queueLock) {
            Deque<QueuedTurn> merged = new ArrayDeque<>(batch.size() + pending.size());
            for (QueuedTurn q : batch) {
                merged.addLast(new QueuedTurn(q.turn(), q.failedAttempts() + 1));
            }
            merged.addAll(pending);
            pending = merged;
        }
    }

    /**
     * Flushes immediately and forgets the session's turn counter. Later turns for the session are rejected.
     *
     * @return number of turns persisted by the forced flush
     */
    public int finalizeSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        synchronized (queueLock) {
            turnCounters.remove(sessionId);
            finalized.put(sessionId, Boolean.TRUE);
        }
        return flush();
    }

    public boolean isFinalized(String sessionId) {
        synchronized (queueLock) {
            return finalized.containsKey(sessionId);
        }
    }

    /**
     * @throws org.springframework.dao.DataAccessException when the counter is gone and the store fails
     */
    public SessionLogStats getSessionStats(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Integer counter;
        int pendingForSession = 0;
        synchronized (queueLock) {
            counter = turnCounters.get(sessionId);
            for (QueuedTurn q : pending) {
                if (q.turn().sessionId().equals(sessionId)) {
                    pendingForSession++;
                }
            }
        }
        int turnCount = counter != null ? counter : store.countBySession(sessionId) + pendingForSession;
        return new SessionLogStats(sessionId, turnCount, pendingForSession);
    }

    public int backlogSize() {
        synchronized (queueLock) {
            return pending.size();
        }
    }

    /** Highest failed-attempt count in the queue; 0 when nothing has failed. */
    public int maxFailedAttempts() {
        synchronized (queueLock) {
            return maxFailedAttempts(pending);
        }
    }

    /** Turns dropped because the store refused them permanently. */
    public long setAsideCount() {
        return setAsideTurns.get();
    }

    public Instant lastSuccessfulFlushAt() {
        return lastSuccessfulFlushAt;
    }

    public Instant lastFailedFlushAt() {
        return lastFailedFlushAt;
    }

    @PreDestroy
    void shutdown() {
        int remaining = backlogSize();
        if (remaining > 0) {
            LOG.info("Flushing {} queued turns before shutdown", remaining);
            flush();
            int left = backlogSize();
            if (left > 0) {
                LOG.error("{} conversation turns could not be persisted before shutdown", left);
            }
        }
    }
}
