package com.phillippitts.voicegate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One utterance by either party within a session. Immutable once persisted.
 *
 * @param sessionId      owning session
 * @param speaker        user or assistant
 * @param turnNumber     1-based, strictly increasing and gap-free per session
 * @param text           final transcript text (never blank)
 * @param timestamp      capture time
 * @param confidence     transcription confidence between 0.0 and 1.0, or null
 * @param responseTimeMs assistant response latency, or null
 * @param annotations    best-effort annotations
 */
public record ConversationTurn(
        String sessionId,
        Speaker speaker,
        int turnNumber,
        String text,
        Instant timestamp,
        Double confidence,
        Long responseTimeMs,
        TurnAnnotations annotations
) {
    public ConversationTurn {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(speaker, "speaker");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
        if (turnNumber < 1) {
            throw new IllegalArgumentException("turnNumber must be >= 1, got: " + turnNumber);
        }
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (annotations == null) {
            annotations = TurnAnnotations.NONE;
        }
    }
}
