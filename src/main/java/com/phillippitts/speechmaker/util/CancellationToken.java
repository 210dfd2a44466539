package com.phillippitts.speechmaker.util;

import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a session and every external call it makes.
 *
 * <p>Work checks {@link #throwIfCancelled(String)} between steps; process wrappers register an
 * {@link #onCancel(Runnable)} callback that destroys the running process. Each callback runs at
 * most once, and a callback registered after cancellation runs immediately.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it drops the callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * A fresh token nobody holds a reference to cancel; for calls outside a session.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Signals cancellation and runs the registered callbacks.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runQuietly(callback);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param operation name used in the exception message
     * @throws ConversionCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new ConversionCancelledException(operation);
        }
    }

    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed: {}", e.toString());
        }
    }
}
