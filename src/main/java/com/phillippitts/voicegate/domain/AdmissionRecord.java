package com.phillippitts.voicegate.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Per-identity usage row consulted by the usage limiter.
 *
 * <p>Durations are monotonic within their window: the daily counter only resets on day rollover,
 * the lifetime counter never resets.
 */
public record AdmissionRecord(
        String identityKey,
        int sessionCount,
        int dailySessionCount,
        LocalDate dailyResetDate,
        long dailyDurationSeconds,
        long lifetimeDurationSeconds,
        Instant firstSessionAt,
        Instant lastSessionAt,
        boolean activeLock,
        boolean blocked,
        String blockedReason
) {
    public AdmissionRecord {
        Objects.requireNonNull(identityKey, "identityKey");
        Objects.requireNonNull(dailyResetDate, "dailyResetDate");
        Objects.requireNonNull(lastSessionAt, "lastSessionAt");
        if (firstSessionAt == null) {
            firstSessionAt = lastSessionAt;
        }
    }

    /** Row written for a first-time visitor: one session counted and the lock taken. */
    public static AdmissionRecord firstVisit(String identityKey, LocalDate today, Instant now) {
        return new AdmissionRecord(identityKey, 1, 1, today, 0, 0, now, now, true, false, null);
    }

    public AdmissionRecord withLock(boolean lock) {
        return new AdmissionRecord(identityKey, sessionCount, dailySessionCount, dailyResetDate,
                dailyDurationSeconds, lifetimeDurationSeconds, firstSessionAt, lastSessionAt,
                lock, blocked, blockedReason);
    }

    public AdmissionRecord rolledOver(LocalDate today) {
        if (today.equals(dailyResetDate)) {
            return this;
        }
        return new AdmissionRecord(identityKey, sessionCount, 0, today, 0, lifetimeDurationSeconds,
                firstSessionAt, lastSessionAt, activeLock, blocked, blockedReason);
    }

    public AdmissionRecord withBlock(String reason) {
        return new AdmissionRecord(identityKey, sessionCount, dailySessionCount, dailyResetDate,
                dailyDurationSeconds, lifetimeDurationSeconds, firstSessionAt, lastSessionAt,
                activeLock, true, reason);
    }

    public AdmissionRecord unblocked() {
        return new AdmissionRecord(identityKey, sessionCount, dailySessionCount, dailyResetDate,
                dailyDurationSeconds, lifetimeDurationSeconds, firstSessionAt, lastSessionAt,
                activeLock, false, null);
    }

    public AdmissionRecord admitted(Instant now) {
        return new AdmissionRecord(identityKey, sessionCount + 1, dailySessionCount + 1, dailyResetDate,
                dailyDurationSeconds, lifetimeDurationSeconds, firstSessionAt, now,
                true, blocked, blockedReason);
    }

    public AdmissionRecord plusDuration(long seconds) {
        return new AdmissionRecord(identityKey, sessionCount, dailySessionCount, dailyResetDate,
                dailyDurationSeconds + seconds, lifetimeDurationSeconds + seconds,
                firstSessionAt, lastSessionAt, activeLock, blocked, blockedReason);
    }
}
