package com.phillippitts.voicegate.service.conversation;

import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;

import java.time.Instant;
import java.util.Objects;

/**
 * A turn accepted for logging, before the logger assigns its number.
 */
public record TurnEntry(
        String sessionId,
        Speaker speaker,
        String text,
        Instant timestamp,
        Double confidence,
        Long responseTimeMs,
        TurnAnnotations annotations
) {
    public TurnEntry {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(speaker, "speaker");
        Objects.requireNonNull(timestamp, "timestamp");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
    }

    ConversationTurn numbered(int turnNumber) {
        return new ConversationTurn(sessionId, speaker, turnNumber, text, timestamp, confidence,
                responseTimeMs, annotations);
    }
}
