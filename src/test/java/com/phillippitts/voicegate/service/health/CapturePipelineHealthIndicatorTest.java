package com.phillippitts.voicegate.service.health;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.service.capture.EventCaptureRouter;
import com.phillippitts.voicegate.service.conversation.ConversationLogger;
import com.phillippitts.voicegate.service.janitor.SessionJanitor;
import com.phillippitts.voicegate.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CapturePipelineHealthIndicatorTest {

    private ConversationLogger logger;
    private EventCaptureRouter router;
    private SessionJanitor janitor;
    private ConversationLogProperties logProps;
    private JanitorProperties janitorProps;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        logger = mock(ConversationLogger.class);
        router = mock(EventCaptureRouter.class);
        janitor = mock(SessionJanitor.class);
        logProps = new ConversationLogProperties();
        janitorProps = new JanitorProperties();
        clock = MutableClock.at("2026-03-10T12:00:00Z");
    }

    private CapturePipelineHealthIndicator indicator() {
        return new CapturePipelineHealthIndicator(logger, router, janitor, logProps, janitorProps, clock);
    }

    @Test
    void shouldReportUpWhenPipelineIdle() {
        when(router.droppedEventCount()).thenReturn(3L);

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Capture pipeline operational");
        assertThat(health.getDetails()).containsEntry("droppedEvents", 3L);
        assertThat(health.getDetails()).containsEntry("janitor", "ok");
    }

    @Test
    void shouldReportDegradedWhenBatchWasRequeued() {
        when(logger.backlogSize()).thenReturn(20);
        when(logger.maxFailedAttempts()).thenReturn(1);

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("backlog", 20);
        assertThat(health.getDetails()).containsEntry("failedFlushAttempts", 1);
    }

    @Test
    void shouldReportDegradedWhenBacklogAboveThreshold() {
        logProps.setBacklogWarnThreshold(100);
        when(logger.backlogSize()).thenReturn(101);

        assertThat(indicator().health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDownWhenStoreKeepsRejectingWrites() {
        when(logger.maxFailedAttempts()).thenReturn(CapturePipelineHealthIndicator.DOWN_AFTER_FAILED_ATTEMPTS);

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Conversation store rejecting writes");
    }

    @Test
    void shouldReportDegradedWhenJanitorLate() {
        CapturePipelineHealthIndicator indicator = indicator();
        clock.advance(Duration.ofMinutes(4));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("janitor", "late");
    }

    @Test
    void shouldReportOkWhenJanitorSweptRecently() {
        CapturePipelineHealthIndicator indicator = indicator();
        clock.advance(Duration.ofMinutes(10));
        when(janitor.lastSweepAt()).thenReturn(clock.instant().minusSeconds(30));

        assertThat(indicator.health().getDetails()).containsEntry("janitor", "ok");
    }

    @Test
    void shouldNotBlameDisabledJanitor() {
        janitorProps.setEnabled(false);
        CapturePipelineHealthIndicator indicator = indicator();
        clock.advance(Duration.ofHours(1));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("janitor", "disabled");
    }
}
