package com.phillippitts.speechmaker.service.retry;

/**
 * Retry bookkeeping for one operation key.
 *
 * @param key caller-supplied operation identity, e.g. {@code <sessionId>:chunk:2}
 * @param attempts attempts recorded so far, never above the policy's maximum
 * @param lastDelayMs last backoff delay applied, 0 before the first pause
 */
public record RetryState(String key, int attempts, long lastDelayMs) {
}
