package com.phillippitts.voicegate.service.events;

import java.time.Instant;

/**
 * Published when the speech provider could not issue a credential.
 *
 * @param retryable  true when retries were exhausted, false for terminal rejections
 * @param attempts   attempts made
 * @param statusCode last HTTP status, or -1 for I/O failures
 */
public record ProviderFailureEvent(
        Instant at,
        String message,
        boolean retryable,
        int attempts,
        int statusCode
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
