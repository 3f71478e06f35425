package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.service.conversation.ConversationLogger;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import com.phillippitts.voicegate.service.session.SessionRegistry;
import com.phillippitts.voicegate.testutil.EventCapturingPublisher;
import com.phillippitts.voicegate.testutil.FlakyTurnStore;
import com.phillippitts.voicegate.testutil.InMemorySessionRegistry;
import com.phillippitts.voicegate.testutil.MutableClock;
import com.phillippitts.voicegate.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventCaptureRouterTest {

    private static final String SESSION = "rt_abc";

    private FlakyTurnStore store;
    private ConversationLogProperties props;
    private InMemorySessionRegistry registry;
    private SimpleMeterRegistry meters;
    private MutableClock clock;
    private ConversationLogger logger;
    private EventCaptureRouter router;

    @BeforeEach
    void setUp() {
        store = new FlakyTurnStore();
        props = new ConversationLogProperties();
        registry = new InMemorySessionRegistry();
        meters = new SimpleMeterRegistry();
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        VoiceSessionMetrics metrics = new VoiceSessionMetrics(meters);
        logger = new ConversationLogger(store, new SyncExecutor(), props, metrics,
                new EventCapturingPublisher(), clock);
        router = new EventCaptureRouter(logger, new KeywordTurnAnnotator(), props, registry, metrics, clock);
        registry.register(VoiceSession.started(SESSION, "203.0.113.7", ModelTier.MINI, VoiceProfile.CEDAR,
                clock.instant()));
    }

    private List<ConversationTurn> persisted() {
        logger.flush();
        return store.findBySession(SESSION);
    }

    private RouteOutcome transcript(Speaker speaker, String text) {
        return router.route(CaptureEvent.transcript(SESSION, speaker, text, true, 0.95, clock.instant()));
    }

    @Test
    void shouldLogFinalTranscriptsAsNumberedTurns() {
        assertThat(transcript(Speaker.USER, "I want to get stronger")).isEqualTo(RouteOutcome.TURN_LOGGED);
        assertThat(transcript(Speaker.ASSISTANT, "Let's plan a workout. Would you like to start today?"))
                .isEqualTo(RouteOutcome.TURN_LOGGED);
        assertThat(transcript(Speaker.USER, "  yes  ")).isEqualTo(RouteOutcome.TURN_LOGGED);

        List<ConversationTurn> turns = persisted();
        assertThat(turns).extracting(ConversationTurn::turnNumber).containsExactly(1, 2, 3);
        assertThat(turns).extracting(ConversationTurn::speaker)
                .containsExactly(Speaker.USER, Speaker.ASSISTANT, Speaker.USER);
        assertThat(turns.get(2).text()).isEqualTo("yes");
        assertThat(turns.get(1).annotations().requiresFollowUp()).isTrue();
        assertThat(turns.get(1).annotations().topic()).isEqualTo("fitness");
        assertThat(turns.get(0).annotations().engagementLevel()).isNotNull();
    }

    @Test
    void shouldAttachResponseLatencyToNextAssistantTurnOnly() {
        Instant speechEnd = clock.instant();
        router.route(CaptureEvent.of(SESSION, CaptureEventType.SPEECH_START, speechEnd.minusSeconds(2)));
        router.route(CaptureEvent.of(SESSION, CaptureEventType.SPEECH_END, speechEnd));
        transcript(Speaker.USER, "how many reps?");
        router.route(CaptureEvent.of(SESSION, CaptureEventType.RESPONSE_START, speechEnd.plusMillis(850)));
        transcript(Speaker.ASSISTANT, "Ten reps.");
        router.route(CaptureEvent.of(SESSION, CaptureEventType.RESPONSE_END, speechEnd.plusSeconds(3)));
        transcript(Speaker.ASSISTANT, "Then rest.");

        List<ConversationTurn> turns = persisted();
        assertThat(turns.get(0).responseTimeMs()).isNull();
        assertThat(turns.get(1).responseTimeMs()).isEqualTo(850L);
        assertThat(turns.get(2).responseTimeMs()).isNull();
    }

    @Test
    void shouldIgnorePartialTranscripts() {
        RouteOutcome outcome = router.route(
                CaptureEvent.transcript(SESSION, Speaker.USER, "I wa", false, null, clock.instant()));

        assertThat(outcome).isEqualTo(RouteOutcome.PARTIAL_IGNORED);
        assertThat(outcome.accepted()).isTrue();
        assertThat(logger.backlogSize()).isZero();
        assertThat(router.droppedEventCount()).isZero();
    }

    @Test
    void shouldDropMalformedEventsAndCountThem() {
        assertThat(router.route(null)).isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        assertThat(router.route(CaptureEvent.transcript(" ", Speaker.USER, "hi", true, null, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        assertThat(router.route(new CaptureEvent(SESSION, null, Speaker.USER, "hi", true, null, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        assertThat(router.route(CaptureEvent.transcript(SESSION, null, "hi", true, null, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        assertThat(router.route(CaptureEvent.transcript(SESSION, Speaker.USER, "hi", true, 1.5, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        assertThat(router.route(CaptureEvent.transcript(SESSION, Speaker.USER, "   ", true, null, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);
        String huge = "a".repeat(EventCaptureRouter.MAX_TEXT_LENGTH + 1);
        assertThat(router.route(CaptureEvent.transcript(SESSION, Speaker.USER, huge, true, null, null)))
                .isEqualTo(RouteOutcome.DROPPED_MALFORMED);

        assertThat(router.droppedEventCount()).isEqualTo(7);
        assertThat(logger.backlogSize()).isZero();
        assertThat(meters.find("voicegate.capture.dropped").tag("reason", "confidence").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldDropEventsForFinalizedSession() {
        transcript(Speaker.USER, "hello");
        assertThat(router.finalizeSession(SESSION)).isEqualTo(1);

        RouteOutcome late = transcript(Speaker.ASSISTANT, "goodbye");

        assertThat(late).isEqualTo(RouteOutcome.DROPPED_CLOSED);
        assertThat(late.accepted()).isFalse();
        assertThat(store.findBySession(SESSION)).hasSize(1);
        assertThat(router.trackedSessions()).isZero();
    }

    @Test
    void shouldDropEventsForUnknownSessionsWithoutTrackingThem() {
        for (int i = 0; i < 5000; i++) {
            String fake = "rt_fake" + i;
            assertThat(router.route(CaptureEvent.transcript(fake, Speaker.USER, "spam", true, null, null)))
                    .isEqualTo(RouteOutcome.DROPPED_CLOSED);
            assertThat(router.route(CaptureEvent.of(fake, CaptureEventType.SPEECH_END, clock.instant())))
                    .isEqualTo(RouteOutcome.DROPPED_CLOSED);
        }

        assertThat(router.trackedSessions()).isZero();
        assertThat(logger.backlogSize()).isZero();
        assertThat(router.droppedEventCount()).isEqualTo(10_000);
        assertThat(meters.find("voicegate.capture.dropped").tag("reason", "unknown_session").counter().count())
                .isEqualTo(10_000.0);
    }

    @Test
    void shouldDropEventsForEndedSession() {
        registry.closeIfActive(SESSION, clock.instant(), "user_ended", 30);

        assertThat(transcript(Speaker.USER, "anyone?")).isEqualTo(RouteOutcome.DROPPED_CLOSED);
        assertThat(router.trackedSessions()).isZero();
        assertThat(persisted()).isEmpty();
    }

    @Test
    void shouldLookUpSessionOnceWhileTracked() {
        SessionRegistry counting = spy(registry);
        EventCaptureRouter r = new EventCaptureRouter(logger, new KeywordTurnAnnotator(), props, counting,
                new VoiceSessionMetrics(meters), clock);

        r.route(CaptureEvent.of(SESSION, CaptureEventType.SPEECH_START, clock.instant()));
        r.route(CaptureEvent.of(SESSION, CaptureEventType.SPEECH_END, clock.instant()));
        r.route(CaptureEvent.transcript(SESSION, Speaker.USER, "hello", true, null, null));

        verify(counting, times(1)).find(SESSION);
        assertThat(r.trackedSessions()).isEqualTo(1);
    }

    @Test
    void shouldRouteWithoutTrackingWhenRegistryIsDown() {
        SessionRegistry broken = mock(SessionRegistry.class);
        when(broken.find(SESSION)).thenThrow(new DataAccessResourceFailureException("down"));
        EventCaptureRouter r = new EventCaptureRouter(logger, new KeywordTurnAnnotator(), props, broken,
                new VoiceSessionMetrics(meters), clock);

        assertThat(r.route(CaptureEvent.transcript(SESSION, Speaker.USER, "hello", true, null, null)))
                .isEqualTo(RouteOutcome.TURN_LOGGED);
        assertThat(r.trackedSessions()).isZero();
        assertThat(persisted()).hasSize(1);
    }

    @Test
    void shouldRecordActivityOnRegistry() {
        clock.advance(Duration.ofMinutes(5));

        transcript(Speaker.USER, "still here");

        assertThat(registry.find(SESSION).orElseThrow().lastActivityAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldLogTurnWithoutAnnotationsWhenAnnotatorFails() {
        TurnAnnotator broken = (speaker, text) -> {
            throw new IllegalStateException("boom");
        };
        EventCaptureRouter r = new EventCaptureRouter(logger, broken, props, registry,
                new VoiceSessionMetrics(meters), clock);

        assertThat(r.route(CaptureEvent.transcript(SESSION, Speaker.USER, "hi", true, null, null)))
                .isEqualTo(RouteOutcome.TURN_LOGGED);
        assertThat(persisted().get(0).annotations()).isEqualTo(TurnAnnotations.NONE);
    }

    @Test
    void shouldSkipAnnotationWhenDisabled() {
        props.setAnnotationsEnabled(false);
        EventCaptureRouter r = new EventCaptureRouter(logger, new KeywordTurnAnnotator(), props, registry,
                new VoiceSessionMetrics(meters), clock);

        r.route(CaptureEvent.transcript(SESSION, Speaker.ASSISTANT, "Great job! Shall we continue?", true, null,
                null));

        assertThat(persisted().get(0).annotations()).isEqualTo(TurnAnnotations.NONE);
    }

    @Test
    void shouldUseArrivalTimeWhenTimestampMissing() {
        router.route(CaptureEvent.transcript(SESSION, Speaker.USER, "no clock", true, null, null));

        assertThat(persisted().get(0).timestamp()).isEqualTo(clock.instant());
    }
}
