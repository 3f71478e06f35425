package com.phillippitts.voicegate.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void ceilUnitsRoundsPartialUnitsUp() {
        assertThat(TimeUtils.ceilUnits(0, 60)).isZero();
        assertThat(TimeUtils.ceilUnits(-5, 60)).isZero();
        assertThat(TimeUtils.ceilUnits(1, 60)).isEqualTo(1);
        assertThat(TimeUtils.ceilUnits(60, 60)).isEqualTo(1);
        assertThat(TimeUtils.ceilUnits(61, 60)).isEqualTo(2);
    }

    @Test
    void ceilUnitsRejectsNonPositiveUnit() {
        assertThatThrownBy(() -> TimeUtils.ceilUnits(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dayAndMidnightFollowZone() {
        Instant lateUtc = Instant.parse("2026-03-10T23:30:00Z");
        ZoneId paris = ZoneId.of("Europe/Paris");

        assertThat(TimeUtils.dayOf(lateUtc, ZoneOffset.UTC)).isEqualTo(LocalDate.parse("2026-03-10"));
        assertThat(TimeUtils.dayOf(lateUtc, paris)).isEqualTo(LocalDate.parse("2026-03-11"));
        assertThat(TimeUtils.nextMidnight(lateUtc, ZoneOffset.UTC)).isEqualTo(Instant.parse("2026-03-11T00:00:00Z"));
        assertThat(TimeUtils.nextMidnight(lateUtc, paris)).isEqualTo(Instant.parse("2026-03-11T23:00:00Z"));
    }

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0);
    }
}
