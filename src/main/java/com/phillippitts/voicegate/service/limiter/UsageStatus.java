package com.phillippitts.voicegate.service.limiter;

import java.time.Instant;

/**
 * Read-only view of an identity's quota counters.
 */
public record UsageStatus(
        String identityKey,
        long dailyCreditsUsed,
        long dailyCreditsRemaining,
        long lifetimeCreditsUsed,
        long lifetimeCreditsRemaining,
        int sessionCount,
        boolean activeSession,
        boolean blocked,
        String blockedReason,
        Instant dailyResetAt
) {
}
