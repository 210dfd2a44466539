package com.phillippitts.speechmaker.service.readiness;

/**
 * Subscription topics of the {@link ReadinessStateMachine}.
 */
public enum ReadinessTopic {
    /** Voice catalog loading state changed. */
    VOICE,
    /** Converter detection result changed. */
    CONVERTER,
    /** Output folder selection changed. */
    OUTPUT_FOLDER,
    /** The convert action changed: initialization, {@code ready} or MP3 availability. */
    ACTION
}
