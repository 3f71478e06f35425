package com.phillippitts.voicegate.service.broker;

import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;

import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived credential letting a browser open one streaming connection to the provider.
 *
 * <p>Returned to the caller once; never cached or persisted.
 */
public record EphemeralSession(
        String sessionId,
        String ephemeralCredential,
        ModelTier modelTier,
        VoiceProfile voiceProfile,
        Instant expiresAt
) {
    public EphemeralSession {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(ephemeralCredential, "ephemeralCredential");
        Objects.requireNonNull(modelTier, "modelTier");
        Objects.requireNonNull(voiceProfile, "voiceProfile");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    @Override
    public String toString() {
        return "EphemeralSession[sessionId=" + sessionId + ", modelTier=" + modelTier.wireName()
                + ", voiceProfile=" + voiceProfile.wireName() + ", expiresAt=" + expiresAt + "]";
    }
}
