package com.phillippitts.voicegate.service.events;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("storage-flush-turns")).isTrue();
        assertThat(l.shouldLog("storage-flush-turns")).isFalse();
        assertThat(l.shouldLog("provider-unavailable")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onStorageFailure(new StorageFailureEvent("flush-turns", Instant.now(), "down",
                    new DataAccessResourceFailureException("down"), Map.of("batchSize", "3")));
            l.onProviderFailure(new ProviderFailureEvent(Instant.now(), "502", true, 3, 502));
        }).doesNotThrowAnyException();
    }

    @Test
    void storageEventDefaultsTimeAndCopiesContext() {
        Map<String, String> context = new HashMap<>();
        context.put("sessionId", "rt_1");

        StorageFailureEvent e = new StorageFailureEvent("record-cost", null, "down", null, context);
        context.put("later", "x");

        assertThat(e.at()).isNotNull();
        assertThat(e.context()).containsOnlyKeys("sessionId");
    }
}
