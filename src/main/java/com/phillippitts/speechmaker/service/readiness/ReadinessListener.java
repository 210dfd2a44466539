package com.phillippitts.speechmaker.service.readiness;

/**
 * Receives readiness changes for one topic. Called outside the state machine's lock; a listener
 * that throws is logged and does not affect other listeners.
 */
@FunctionalInterface
public interface ReadinessListener {

    void onChange(ReadinessTopic topic, ReadinessSnapshot snapshot);
}
