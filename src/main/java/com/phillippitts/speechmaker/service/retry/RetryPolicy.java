package com.phillippitts.speechmaker.service.retry;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.util.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backoff timing and per-key attempt counting.
 *
 * <p>The policy is mechanism only: whether a failure may be retried at all is decided by the
 * classifier's {@link ErrorRecord#canRetry()} flag, which {@link #shouldRetry(ErrorRecord)} returns
 * as is.
 *
 * <p>Delay for attempt {@code n} (0-based) is {@code min(baseDelayMs * 2^n, capDelayMs)}; with the
 * defaults that is 1000, 2000, 4000, 8000, 10000, 10000, ...
 *
 * <p>Counters are monotonic until {@link #reset(String)}; they never exceed {@code maxAttempts}.
 * Thread-safe.
 */
public final class RetryPolicy {

    private static final Logger LOG = LogManager.getLogger(RetryPolicy.class);

    private final long baseDelayMs;
    private final long capDelayMs;
    private final int maxAttempts;
    private final Sleeper sleeper;
    private final Map<String, RetryState> states = new ConcurrentHashMap<>();

    public RetryPolicy(long baseDelayMs, long capDelayMs, int maxAttempts, Sleeper sleeper) {
        if (baseDelayMs <= 0 || capDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Require 0 < baseDelayMs <= capDelayMs, got base="
                    + baseDelayMs + ", cap=" + capDelayMs);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.capDelayMs = capDelayMs;
        this.maxAttempts = maxAttempts;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @param attempt 0-based retry number
     * @return backoff delay in milliseconds
     */
    public long delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt >= Long.SIZE - 1 || baseDelayMs > (capDelayMs >> attempt)) {
            return capDelayMs;
        }
        return Math.min(baseDelayMs << attempt, capDelayMs);
    }

    public boolean shouldRetry(ErrorRecord error) {
        return error != null && error.canRetry();
    }

    /**
     * Records one more attempt for the key.
     *
     * @return attempts recorded so far, capped at {@code maxAttempts}
     */
    public int nextAttempt(String key) {
        Objects.requireNonNull(key, "key");
        return states.compute(key, (k, s) -> s == null
                ? new RetryState(k, 1, 0)
                : new RetryState(k, Math.min(s.attempts() + 1, maxAttempts), s.lastDelayMs())).attempts();
    }

    public int attempts(String key) {
        RetryState state = states.get(key);
        return state == null ? 0 : state.attempts();
    }

    public boolean hasAttemptsRemaining(String key) {
        return attempts(key) < maxAttempts;
    }

    /**
     * Waits out the backoff for the key's latest attempt ({@code delay(attempts - 1)}).
     *
     * @return the delay applied, in milliseconds
     * @throws ConversionCancelledException if the token is cancelled or the thread interrupted
     */
    public long pause(String key, CancellationToken token) {
        long delayMs = delay(Math.max(0, attempts(key) - 1));
        states.computeIfPresent(key, (k, s) -> new RetryState(k, s.attempts(), delayMs));
        LOG.debug("Backing off {} ms before retrying {}", delayMs, key);
        try {
            sleeper.sleep(delayMs, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionCancelledException("retry backoff");
        }
        token.throwIfCancelled("retry backoff");
        return delayMs;
    }

    public Optional<RetryState> state(String key) {
        return Optional.ofNullable(states.get(key));
    }

    /** Clears the key after success or session teardown. */
    public void reset(String key) {
        states.remove(key);
    }

    /** Clears every key starting with the prefix, e.g. all chunk keys of a finished session. */
    public void resetAll(String keyPrefix) {
        states.keySet().removeIf(k -> k.startsWith(keyPrefix));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
