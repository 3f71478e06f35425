package com.phillippitts.voicegate.domain;

import java.time.Instant;

/**
 * Outcome of an admission check.
 *
 * @param allowed          whether a new session may start
 * @param remainingCredits daily credits left after this admission (0 on denial)
 * @param reason           human-readable denial reason, null when allowed
 * @param resetAt          when the daily quota resets, only set for daily-limit denials
 * @param blocked          whether the identity is permanently blocked
 */
public record AdmissionDecision(
        boolean allowed,
        int remainingCredits,
        String reason,
        Instant resetAt,
        boolean blocked
) {
    public static AdmissionDecision admit(int remainingCredits) {
        return new AdmissionDecision(true, Math.max(0, remainingCredits), null, null, false);
    }

    public static AdmissionDecision deny(String reason) {
        return new AdmissionDecision(false, 0, reason, null, false);
    }

    public static AdmissionDecision dailyLimit(String reason, Instant resetAt) {
        return new AdmissionDecision(false, 0, reason, resetAt, false);
    }

    public static AdmissionDecision blocked(String reason) {
        return new AdmissionDecision(false, 0, reason, null, true);
    }
}
