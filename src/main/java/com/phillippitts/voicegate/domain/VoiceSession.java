package com.phillippitts.voicegate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent record of one real-time voice session.
 *
 * @param sessionId       unique id shared with the provider-facing client
 * @param identityKey     admission key of the owning client ({@link ClientIdentity#key()})
 * @param modelTier       model the credential was issued for
 * @param voiceProfile    output voice
 * @param status          lifecycle status
 * @param startedAt       admission time
 * @param lastActivityAt  last heartbeat or captured activity
 * @param endedAt         close time, null while active
 * @param endReason       close reason code, null while active
 * @param durationSeconds reported or inferred duration, 0 while active
 */
public record VoiceSession(
        String sessionId,
        String identityKey,
        ModelTier modelTier,
        VoiceProfile voiceProfile,
        SessionStatus status,
        Instant startedAt,
        Instant lastActivityAt,
        Instant endedAt,
        String endReason,
        long durationSeconds
) {
    public VoiceSession {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(identityKey, "identityKey");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        if (lastActivityAt == null) {
            lastActivityAt = startedAt;
        }
    }

    public static VoiceSession started(String sessionId, String identityKey, ModelTier tier,
                                       VoiceProfile voice, Instant now) {
        return new VoiceSession(sessionId, identityKey, tier, voice, SessionStatus.ACTIVE,
                now, now, null, null, 0);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /** Duration inferred from activity timestamps, used when a session is reclaimed without a client report. */
    public long inferredDurationSeconds() {
        long seconds = lastActivityAt.getEpochSecond() - startedAt.getEpochSecond();
        return Math.max(0, seconds);
    }
}
