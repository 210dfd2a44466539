package com.phillippitts.speechmaker.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineTest {

    @Test
    void remainingShrinksAndNeverGoesNegative() throws InterruptedException {
        Deadline deadline = Deadline.afterMillis(20);

        assertThat(deadline.remaining()).isLessThanOrEqualTo(Duration.ofMillis(20));
        Thread.sleep(40);

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThat(deadline.budget()).isEqualTo(Duration.ofMillis(20));
    }

    @Test
    void negativeBudgetIsRejected() {
        assertThatThrownBy(() -> Deadline.after(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
