package com.phillippitts.voicegate.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a store operation fails and the caller degrades (denies admission, requeues a batch).
 *
 * <p>PII note: identities in context must be masked. Never include transcript text.
 */
public record StorageFailureEvent(
        String operation,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public StorageFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
