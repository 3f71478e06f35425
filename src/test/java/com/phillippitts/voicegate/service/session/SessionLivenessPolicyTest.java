package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.domain.AdmissionRecord;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.service.session.SessionLivenessPolicy.LockState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLivenessPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final SessionLivenessPolicy policy =
            new SessionLivenessPolicy(new UsageLimitProperties(), new JanitorProperties());

    private static AdmissionRecord lockedAt(Instant lastSession, boolean lock) {
        return new AdmissionRecord("k", 1, 1, LocalDate.parse("2026-03-10"), 0, 0, lastSession, lastSession,
                lock, false, null);
    }

    @Test
    void classifiesLockByGraceWindow() {
        assertThat(policy.classifyLock(lockedAt(NOW.minusSeconds(10), false), NOW)).isEqualTo(LockState.FREE);
        assertThat(policy.classifyLock(lockedAt(NOW.minusSeconds(10), true), NOW)).isEqualTo(LockState.RECENT);
        assertThat(policy.classifyLock(lockedAt(NOW.minusSeconds(31), true), NOW)).isEqualTo(LockState.ORPHANED);
    }

    @Test
    void usesConfiguredWindows() {
        assertThat(policy.lockGrace()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.inactivityCutoff(NOW)).isEqualTo(NOW.minus(Duration.ofMinutes(30)));
        assertThat(policy.heartbeatCutoff(NOW)).isEqualTo(NOW.minus(Duration.ofMinutes(15)));
    }

    @Test
    void sessionPastLockGraceIsNotYetInactive() {
        VoiceSession s = VoiceSession.started("rt_1", "k", ModelTier.MINI, VoiceProfile.CEDAR, NOW.minusSeconds(31));

        assertThat(policy.isInactive(s, NOW)).isFalse();
        assertThat(policy.isInactive(s, NOW.plus(Duration.ofMinutes(31)))).isTrue();
    }
}
