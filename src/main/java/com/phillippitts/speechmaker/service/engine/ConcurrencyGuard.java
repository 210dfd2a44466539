package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.ExternalProcessExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps simultaneous engine processes across all sessions with a semaphore.
 *
 * <p>Waiting is bounded: a caller that cannot get a permit within the timeout fails with a
 * retryable {@code ENGINE_TIMEOUT} instead of queueing forever.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... run the engine ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
final class ConcurrencyGuard {

    private static final Logger LOG = LogManager.getLogger(ConcurrencyGuard.class);

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String toolName;

    ConcurrencyGuard(int permits, long timeoutMs, String toolName) {
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeoutMs;
        this.toolName = toolName;
    }

    void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("{} concurrency limit reached after {}ms wait", toolName, timeoutMs);
                throw ExternalProcessExceptionBuilder
                        .create(toolName + " concurrency limit reached after " + timeoutMs + "ms wait")
                        .tool(toolName)
                        .code(ErrorCodes.ENGINE_TIMEOUT)
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionCancelledException("waiting for " + toolName);
        }
    }

    void release() {
        semaphore.release();
    }

    int availablePermits() {
        return semaphore.availablePermits();
    }
}
