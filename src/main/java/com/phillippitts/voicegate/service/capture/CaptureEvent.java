package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.domain.Speaker;

import java.time.Instant;

/**
 * One event reported for a session. Fields are nullable here; the router validates them and drops
 * malformed events.
 *
 * @param sessionId  owning session
 * @param type       event type
 * @param speaker    transcript speaker, transcripts only
 * @param text       transcript text, transcripts only
 * @param finalText  true for final transcripts, false for partial ones
 * @param confidence transcription confidence between 0 and 1, optional
 * @param timestamp  client capture time, optional (arrival time is used when absent)
 */
public record CaptureEvent(
        String sessionId,
        CaptureEventType type,
        Speaker speaker,
        String text,
        boolean finalText,
        Double confidence,
        Instant timestamp
) {
    public static CaptureEvent of(String sessionId, CaptureEventType type, Instant timestamp) {
        return new CaptureEvent(sessionId, type, null, null, false, null, timestamp);
    }

    public static CaptureEvent transcript(String sessionId, Speaker speaker, String text, boolean finalText,
                                          Double confidence, Instant timestamp) {
        return new CaptureEvent(sessionId, CaptureEventType.TRANSCRIPT, speaker, text, finalText, confidence,
                timestamp);
    }
}
