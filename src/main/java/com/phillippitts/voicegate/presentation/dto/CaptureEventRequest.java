package com.phillippitts.voicegate.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.service.capture.CaptureEvent;
import com.phillippitts.voicegate.service.capture.CaptureEventType;

import java.time.Instant;

/**
 * Wire form of a capture event. Not bean-validated: unknown or missing values map to null and the
 * router drops the event, so clients always get {@code {accepted}} back.
 */
public record CaptureEventRequest(
        @JsonProperty("session_id") String sessionId,
        String type,
        String speaker,
        String text,
        @JsonProperty("is_final") Boolean isFinal,
        Double confidence,
        Instant timestamp
) {
    public CaptureEvent toEvent() {
        return new CaptureEvent(sessionId,
                CaptureEventType.fromWire(type).orElse(null),
                Speaker.fromWire(speaker).orElse(null),
                text,
                isFinal == null || isFinal,
                confidence,
                timestamp);
    }
}
