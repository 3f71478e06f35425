package com.phillippitts.voicegate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the voice session pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Admission outcomes (admitted, denied by reason, failed closed)</li>
 *   <li>Provider credential calls (latency, attempts, failures)</li>
 *   <li>Session closes by reason and janitor sweep duration</li>
 *   <li>Capture events dropped and turns flushed or requeued</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VoiceSessionMetrics {

    private static final String METRIC_PREFIX = "voicegate";

    private final MeterRegistry registry;

    public VoiceSessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one admission decision.
     *
     * @param outcome admitted, daily_limit, lifetime_limit, blocked, error
     */
    public void recordAdmission(String outcome) {
        Counter.builder(METRIC_PREFIX + ".admission")
                .description("Admission decisions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a credential request against the provider.
     *
     * @param outcome       success, unavailable, rejected
     * @param attempts      attempts made, including the final one
     * @param durationNanos total time including backoff
     */
    public void recordProviderCall(String outcome, int attempts, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".provider.latency")
                .description("Time taken to obtain an ephemeral credential")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".provider.attempts")
                .description("Provider attempts including retries")
                .tag("outcome", outcome)
                .register(registry)
                .increment(attempts);
    }

    public void recordSessionClosed(String reason) {
        Counter.builder(METRIC_PREFIX + ".session.closed")
                .description("Sessions closed by end reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records one janitor sweep.
     *
     * @param sweep         timeout or heartbeat
     * @param closed        sessions this run closed
     * @param failed        sessions whose close threw
     * @param durationNanos wall-clock duration of the run
     */
    public void recordSweep(String sweep, int closed, int failed, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".janitor.sweep")
                .description("Janitor sweep duration")
                .tag("sweep", sweep)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".janitor.closed")
                .tag("sweep", sweep)
                .register(registry)
                .increment(closed);
        if (failed > 0) {
            Counter.builder(METRIC_PREFIX + ".janitor.failed")
                    .tag("sweep", sweep)
                    .register(registry)
                    .increment(failed);
        }
    }

    public void incrementDroppedEvent(String reason) {
        Counter.builder(METRIC_PREFIX + ".capture.dropped")
                .description("Capture events dropped before becoming turns")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFlush(int turns, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".conversation.flush")
                .description("Bulk write of queued conversation turns")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".conversation.turns.persisted")
                .register(registry)
                .increment(turns);
    }

    public void incrementFlushFailure(int requeued) {
        Counter.builder(METRIC_PREFIX + ".conversation.flush.failure")
                .description("Failed flushes; the batch was requeued")
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".conversation.turns.requeued")
                .register(registry)
                .increment(requeued);
    }

    public void incrementTurnsSetAside(int turns) {
        Counter.builder(METRIC_PREFIX + ".conversation.turns.set_aside")
                .description("Turns the store refused permanently after repeated batch failures")
                .register(registry)
                .increment(turns);
    }
}
