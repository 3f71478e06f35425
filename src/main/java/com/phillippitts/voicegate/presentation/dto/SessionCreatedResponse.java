package com.phillippitts.voicegate.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.voicegate.service.broker.EphemeralSession;

import java.time.Instant;

public record SessionCreatedResponse(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("client_secret") String clientSecret,
        String model,
        String voice,
        @JsonProperty("expires_at") Instant expiresAt,
        int remainingCredits,
        int maxDurationSeconds
) {
    public static SessionCreatedResponse of(EphemeralSession session, int remainingCredits, int maxDurationSeconds) {
        return new SessionCreatedResponse(session.sessionId(), session.ephemeralCredential(),
                session.modelTier().wireName(), session.voiceProfile().wireName(), session.expiresAt(),
                remainingCredits, maxDurationSeconds);
    }
}
