package com.phillippitts.voicegate.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateReturnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
    }

    @Test
    void truncateCutsLongText() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hi", 5)).isEqualTo("hi");
    }

    @Test
    void maskIdentityKeepsShortPrefix() {
        assertThat(LogSanitizer.maskIdentity("203.0.113.7|device")).isEqualTo("203.0.11...");
        assertThat(LogSanitizer.maskIdentity("::1")).isEqualTo(":...");
        assertThat(LogSanitizer.maskIdentity("")).isEmpty();
        assertThat(LogSanitizer.maskIdentity(null)).isEmpty();
    }
}
