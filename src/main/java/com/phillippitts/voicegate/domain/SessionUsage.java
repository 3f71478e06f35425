package com.phillippitts.voicegate.domain;

/**
 * Raw consumption counters reported for a finished session.
 */
public record SessionUsage(
        long durationSeconds,
        long textInputTokens,
        long textOutputTokens,
        double audioInputSeconds,
        double audioOutputSeconds,
        boolean errorOccurred
) {
    public SessionUsage {
        if (durationSeconds < 0 || textInputTokens < 0 || textOutputTokens < 0
                || audioInputSeconds < 0 || audioOutputSeconds < 0) {
            throw new IllegalArgumentException("usage counters must not be negative");
        }
    }

    public static SessionUsage durationOnly(long durationSeconds) {
        return new SessionUsage(durationSeconds, 0, 0, 0, 0, false);
    }
}
