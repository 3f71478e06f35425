package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.service.conversation.ConversationLogger;
import com.phillippitts.voicegate.service.conversation.TurnEntry;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import com.phillippitts.voicegate.service.session.SessionRegistry;
import com.phillippitts.voicegate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the provider event stream of a session into conversation turns.
 *
 * <p>Only final transcripts with non-blank text become turns. Speech and response start/end events
 * feed timing metadata: the response latency ({@code response_start} minus the last
 * {@code speech_end}) is attached to the next assistant turn. Turn numbers come from the
 * {@link ConversationLogger} at acceptance, never from event timestamps.
 *
 * <p>A session is looked up in the {@link SessionRegistry} the first time it is seen; events for
 * unknown or ended sessions are dropped as {@link RouteOutcome#DROPPED_CLOSED} and leave no state
 * behind. Sessions that pass are tracked until {@link #finalizeSession(String)}.
 *
 * <p>Malformed events are dropped and counted. {@link #route(CaptureEvent)} never throws.
 */
@Service
public class EventCaptureRouter {
    private static final Logger LOG = LogManager.getLogger(EventCaptureRouter.class);

    static final int MAX_TEXT_LENGTH = 10_000;
    private static final int MAX_SESSION_ID_LENGTH = 64;

    /** Activity is written to the registry at most this often per session. */
    private static final Duration TOUCH_INTERVAL = Duration.ofSeconds(30);

    private static final class SessionTiming {
        Instant lastSpeechEnd;
        Long pendingLatencyMs;
        Instant responseStartedAt;
        Instant lastTouchedAt;
    }

    private final ConversationLogger logger;
    private final TurnAnnotator annotator;
    private final SessionRegistry registry;
    private final VoiceSessionMetrics metrics;
    private final Clock clock;

    private final Map<String, SessionTiming> timings = new ConcurrentHashMap<>();
    private final AtomicLong droppedEvents = new AtomicLong();

    public EventCaptureRouter(ConversationLogger logger,
                              TurnAnnotator annotator,
                              ConversationLogProperties props,
                              SessionRegistry registry,
                              VoiceSessionMetrics metrics,
                              Clock clock) {
        this.logger = Objects.requireNonNull(logger);
        this.annotator = props.isAnnotationsEnabled() ? Objects.requireNonNull(annotator) : TurnAnnotator.NONE;
        this.registry = Objects.requireNonNull(registry);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    public RouteOutcome route(CaptureEvent event) {
        try {
            String problem = validate(event);
            if (problem != null) {
                return drop(event, problem);
            }
            if (logger.isFinalized(event.sessionId())) {
                return drop(event, "session_closed", RouteOutcome.DROPPED_CLOSED);
            }
            SessionTiming t = timing(event.sessionId());
            if (t == null) {
                return drop(event, "unknown_session", RouteOutcome.DROPPED_CLOSED);
            }
            Instant at = event.timestamp() != null ? event.timestamp() : clock.instant();
            return switch (event.type()) {
                case SPEECH_START -> RouteOutcome.TIMING_RECORDED;
                case SPEECH_END -> onSpeechEnd(t, at);
                case RESPONSE_START -> onResponseStart(t, at);
                case RESPONSE_END -> onResponseEnd(event.sessionId(), t, at);
                case TRANSCRIPT -> onTranscript(event, t, at);
            };
        } catch (RuntimeException e) {
            LOG.error("Unexpected error routing {} event", event == null ? null : event.type(), e);
            return drop(event, "error");
        }
    }

    private static String validate(CaptureEvent e) {
        if (e == null) {
            return "null_event";
        }
        if (e.sessionId() == null || e.sessionId().isBlank() || e.sessionId().length() > MAX_SESSION_ID_LENGTH) {
            return "session_id";
        }
        if (e.type() == null) {
            return "type";
        }
        if (e.type() == CaptureEventType.TRANSCRIPT) {
            if (e.speaker() == null) {
                return "speaker";
            }
            if (e.text() != null && e.text().length() > MAX_TEXT_LENGTH) {
                return "text_length";
            }
            if (e.confidence() != null && (e.confidence().isNaN() || e.confidence() < 0.0 || e.confidence() > 1.0)) {
                return "confidence";
            }
        }
        return null;
    }

    private RouteOutcome onSpeechEnd(SessionTiming t, Instant at) {
        synchronized (t) {
            t.lastSpeechEnd = at;
        }
        return RouteOutcome.TIMING_RECORDED;
    }

    private RouteOutcome onResponseStart(SessionTiming t, Instant at) {
        synchronized (t) {
            t.responseStartedAt = at;
            if (t.lastSpeechEnd != null) {
                t.pendingLatencyMs = Math.max(0, Duration.between(t.lastSpeechEnd, at).toMillis());
            }
        }
        return RouteOutcome.TIMING_RECORDED;
    }

    private RouteOutcome onResponseEnd(String sessionId, SessionTiming t, Instant at) {
        synchronized (t) {
            if (t.responseStartedAt != null) {
                LOG.debug("Response in session {} lasted {} ms",
                        sessionId, Duration.between(t.responseStartedAt, at).toMillis());
                t.responseStartedAt = null;
            }
        }
        return RouteOutcome.TIMING_RECORDED;
    }

    private RouteOutcome onTranscript(CaptureEvent event, SessionTiming t, Instant at) {
        if (!event.finalText()) {
            return RouteOutcome.PARTIAL_IGNORED;
        }
        if (event.text() == null || event.text().isBlank()) {
            return drop(event, "blank_text");
        }

        String text = event.text().strip();
        Long latency = null;
        if (event.speaker() == Speaker.ASSISTANT) {
            synchronized (t) {
                latency = t.pendingLatencyMs;
                t.pendingLatencyMs = null;
            }
        }

        TurnAnnotations annotations = annotate(event.speaker(), text);
        ConversationTurn turn = logger.logTurn(new TurnEntry(event.sessionId(), event.speaker(), text, at,
                event.confidence(), latency, annotations));
        if (turn == null) {
            timings.remove(event.sessionId());
            return drop(event, "session_closed", RouteOutcome.DROPPED_CLOSED);
        }

        LOG.debug("Turn {} of session {} ({}): '{}'", turn.turnNumber(), turn.sessionId(),
                turn.speaker().dbValue(), LogSanitizer.truncate(text, 40));
        touchIfDue(event.sessionId(), t, at);
        return RouteOutcome.TURN_LOGGED;
    }

    private TurnAnnotations annotate(Speaker speaker, String text) {
        try {
            return annotator.annotate(speaker, text);
        } catch (RuntimeException e) {
            LOG.warn("Annotation failed, logging turn without annotations: {}", e.toString());
            return TurnAnnotations.NONE;
        }
    }

    private void touchIfDue(String sessionId, SessionTiming t, Instant at) {
        Instant now = clock.instant();
        synchronized (t) {
            if (t.lastTouchedAt != null && Duration.between(t.lastTouchedAt, now).compareTo(TOUCH_INTERVAL) < 0) {
                return;
            }
            t.lastTouchedAt = now;
        }
        try {
            registry.touch(sessionId, at.isAfter(now) ? now : at);
        } catch (DataAccessException e) {
            LOG.warn("Could not record activity for session {}: {}", sessionId, e.toString());
        }
    }

    /**
     * Timing state of an open session, or null when the registry does not know the session as active.
     * Only sessions that pass the lookup are tracked. When the registry cannot be read the event is
     * accepted with untracked state.
     */
    private SessionTiming timing(String sessionId) {
        SessionTiming known = timings.get(sessionId);
        if (known != null) {
            return known;
        }
        Optional<VoiceSession> session;
        try {
            session = registry.find(sessionId);
        } catch (DataAccessException e) {
            LOG.warn("Could not look up session {}; routing without tracking: {}", sessionId, e.toString());
            return new SessionTiming();
        }
        if (session.isEmpty() || !session.get().isActive()) {
            return null;
        }
        return timings.computeIfAbsent(sessionId, id -> new SessionTiming());
    }

    private RouteOutcome drop(CaptureEvent event, String reason) {
        return drop(event, reason, RouteOutcome.DROPPED_MALFORMED);
    }

    private RouteOutcome drop(CaptureEvent event, String reason, RouteOutcome outcome) {
        droppedEvents.incrementAndGet();
        metrics.incrementDroppedEvent(reason);
        LOG.debug("Dropped capture event: reason={}, session={}", reason,
                event == null ? null : LogSanitizer.truncate(event.sessionId(), MAX_SESSION_ID_LENGTH));
        return outcome;
    }

    /**
     * Releases the session's timing state and finalizes its turn log.
     *
     * @return turns persisted by the final flush
     */
    public int finalizeSession(String sessionId) {
        timings.remove(sessionId);
        return logger.finalizeSession(sessionId);
    }

    public long droppedEventCount() {
        return droppedEvents.get();
    }

    int trackedSessions() {
        return timings.size();
    }
}
