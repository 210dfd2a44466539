package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.ExternalProcessException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void acquireTimesOutWithRetryableEngineTimeout() {
        // Arrange
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 50, "edge-tts");
        guard.acquire();

        // Act / Assert
        assertThatThrownBy(guard::acquire)
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("concurrency limit reached")
                .satisfies(e -> assertThat(((ExternalProcessException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.ENGINE_TIMEOUT));
    }

    @Test
    void releaseReturnsPermit() {
        ConcurrencyGuard guard = new ConcurrencyGuard(2, 50, "edge-tts");

        guard.acquire();
        guard.acquire();
        assertThat(guard.availablePermits()).isZero();

        guard.release();
        assertThat(guard.availablePermits()).isEqualTo(1);
    }
}
