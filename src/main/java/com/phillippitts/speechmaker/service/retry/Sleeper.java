package com.phillippitts.speechmaker.service.retry;

import com.phillippitts.speechmaker.util.CancellationToken;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Waits out a backoff delay. Tests substitute a recording implementation that returns at once.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks for up to {@code millis}, returning early when the token is cancelled.
     */
    void sleep(long millis, CancellationToken token) throws InterruptedException;

    Sleeper SYSTEM = (millis, token) -> {
        CountDownLatch cancelled = new CountDownLatch(1);
        try (CancellationToken.Registration ignored = token.onCancel(cancelled::countDown)) {
            cancelled.await(millis, TimeUnit.MILLISECONDS);
        }
    };
}
