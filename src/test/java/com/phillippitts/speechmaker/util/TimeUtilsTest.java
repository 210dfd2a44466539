package com.phillippitts.speechmaker.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsAndTruncatesNanos() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedIsMeasuredFromStart() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(5L).isLessThan(5_000L);
        assertThat(TimeUtils.elapsed(start)).isGreaterThanOrEqualTo(Duration.ofMillis(5));
    }
}
