package com.phillippitts.speechmaker.service.readiness;

/**
 * Handle for a registered {@link ReadinessListener}.
 */
@FunctionalInterface
public interface Subscription {

    /** Stops delivery. Idempotent. */
    void unsubscribe();
}
