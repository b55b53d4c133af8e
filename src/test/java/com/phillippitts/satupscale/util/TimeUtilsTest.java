package com.phillippitts.satupscale.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void formatsUtcWithSecondPrecision() {
        assertThat(TimeUtils.formatUtcSeconds(Instant.parse("2024-05-01T12:34:56.789Z")))
                .isEqualTo("2024-05-01T12:34:56Z");
    }
}
