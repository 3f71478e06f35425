package com.phillippitts.voicegate.service.health;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.service.capture.EventCaptureRouter;
import com.phillippitts.voicegate.service.conversation.ConversationLogger;
import com.phillippitts.voicegate.service.janitor.SessionJanitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Health of the transcript capture pipeline and the session janitor.
 *
 * <ul>
 *   <li>UP: backlog under threshold, no failed flush pending, janitor sweeping on time</li>
 *   <li>DEGRADED: backlog over threshold, a requeued batch waiting, or janitor late</li>
 *   <li>DOWN: the oldest queued batch failed {@value #DOWN_AFTER_FAILED_ATTEMPTS} times or more</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class CapturePipelineHealthIndicator implements HealthIndicator {

    static final int DOWN_AFTER_FAILED_ATTEMPTS = 10;

    /** Janitor is late when no run finished within this many sweep intervals. */
    private static final int LATE_AFTER_INTERVALS = 3;

    private final ConversationLogger logger;
    private final EventCaptureRouter router;
    private final SessionJanitor janitor;
    private final ConversationLogProperties logProps;
    private final JanitorProperties janitorProps;
    private final Clock clock;
    private final Instant startedAt;

    public CapturePipelineHealthIndicator(ConversationLogger logger,
                                          EventCaptureRouter router,
                                          SessionJanitor janitor,
                                          ConversationLogProperties logProps,
                                          JanitorProperties janitorProps,
                                          Clock clock) {
        this.logger = logger;
        this.router = router;
        this.janitor = janitor;
        this.logProps = logProps;
        this.janitorProps = janitorProps;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public Health health() {
        int backlog = logger.backlogSize();
        int failedAttempts = logger.maxFailedAttempts();
        String janitorStatus = janitorStatus();

        Health.Builder builder;
        if (failedAttempts >= DOWN_AFTER_FAILED_ATTEMPTS) {
            builder = Health.down().withDetail("status", "Conversation store rejecting writes");
        } else if (backlog > logProps.getBacklogWarnThreshold() || failedAttempts > 0 || "late".equals(janitorStatus)) {
            builder = Health.status("DEGRADED").withDetail("status", "Capture pipeline lagging");
        } else {
            builder = Health.up().withDetail("status", "Capture pipeline operational");
        }

        return builder
                .withDetail("backlog", backlog)
                .withDetail("failedFlushAttempts", failedAttempts)
                .withDetail("droppedEvents", router.droppedEventCount())
                .withDetail("lastSuccessfulFlush", String.valueOf(logger.lastSuccessfulFlushAt()))
                .withDetail("janitor", janitorStatus)
                .build();
    }

    private String janitorStatus() {
        if (!janitorProps.isEnabled()) {
            return "disabled";
        }
        Instant reference = janitor.lastSweepAt() != null ? janitor.lastSweepAt() : startedAt;
        Duration allowed = Duration.ofMillis(janitorProps.getSweepIntervalMs() * LATE_AFTER_INTERVALS);
        return Duration.between(reference, clock.instant()).compareTo(allowed) > 0 ? "late" : "ok";
    }
}
