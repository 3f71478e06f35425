package com.phillippitts.voicegate.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceSessionTest {

    private static final Instant START = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void startedSessionIsActiveWithActivityAtStart() {
        VoiceSession s = VoiceSession.started("rt_1", "k", ModelTier.MINI, VoiceProfile.CEDAR, START);

        assertThat(s.isActive()).isTrue();
        assertThat(s.lastActivityAt()).isEqualTo(START);
        assertThat(s.inferredDurationSeconds()).isZero();
    }

    @Test
    void inferredDurationFollowsLastActivity() {
        VoiceSession s = new VoiceSession("rt_1", "k", ModelTier.MINI, VoiceProfile.CEDAR, SessionStatus.ACTIVE,
                START, START.plusSeconds(95), null, null, 0);

        assertThat(s.inferredDurationSeconds()).isEqualTo(95);
    }

    @Test
    void modelTierAndVoiceParseWireNames() {
        assertThat(ModelTier.fromWire("gpt-realtime")).isEqualTo(ModelTier.STANDARD);
        assertThat(ModelTier.fromWire("gpt-realtime-mini")).isEqualTo(ModelTier.MINI);
        assertThat(VoiceProfile.fromWire("Marin")).isEqualTo(VoiceProfile.MARIN);
        assertThatThrownBy(() -> ModelTier.fromWire("gpt-4")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VoiceProfile.fromWire("robot")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void usageRejectsNegativeCounters() {
        assertThatThrownBy(() -> new SessionUsage(-1, 0, 0, 0, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
