package com.phillippitts.voicegate.presentation.dto;

import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.util.LogSanitizer;

import java.time.Instant;

/**
 * Operator view of an active session. The identity is masked.
 */
public record ActiveSessionView(
        String sessionId,
        String identity,
        String model,
        String voice,
        Instant startedAt,
        Instant lastActivityAt
) {
    public static ActiveSessionView of(VoiceSession s) {
        return new ActiveSessionView(s.sessionId(), LogSanitizer.maskIdentity(s.identityKey()),
                s.modelTier().wireName(), s.voiceProfile().wireName(), s.startedAt(), s.lastActivityAt());
    }
}
