package com.phillippitts.voicegate.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for degradation events. Privacy-safe and throttled to avoid log spam
 * while the store or the provider is down.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onStorageFailure(StorageFailureEvent e) {
        String key = "storage-" + e.operation();
        if (shouldLog(key)) {
            LOG.error("Store operation '{}' failed: {} context={}. Further failures suppressed for {}s.",
                    e.operation(), e.message(), e.context(), THROTTLE.toSeconds(), e.cause());
        }
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        String key = "provider-" + (e.retryable() ? "unavailable" : "rejected");
        if (shouldLog(key)) {
            if (e.retryable()) {
                LOG.error("Speech provider unavailable after {} attempts (last status {}): {}",
                        e.attempts(), e.statusCode(), e.message());
            } else {
                LOG.error("Speech provider rejected credential request (status {}): {}. "
                        + "Check voice.provider.* properties.", e.statusCode(), e.message());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
