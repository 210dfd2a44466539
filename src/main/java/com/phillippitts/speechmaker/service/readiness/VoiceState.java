package com.phillippitts.speechmaker.service.readiness;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.domain.Voice;

import java.util.List;

/**
 * Voice catalog input of the readiness state machine.
 *
 * @param loaded a non-empty catalog is available
 * @param voices the catalog, empty unless loaded
 * @param attempts listing attempts made by the last resolution
 * @param loading a resolution is running
 * @param lastError last classified listing failure, null if none
 */
public record VoiceState(boolean loaded, List<Voice> voices, int attempts, boolean loading, ErrorRecord lastError) {

    public VoiceState {
        voices = voices == null ? List.of() : List.copyOf(voices);
    }

    public static VoiceState initial() {
        return new VoiceState(false, List.of(), 0, false, null);
    }

    /** A resolution started; keeps the previous attempt count so the retry hint stays visible. */
    public static VoiceState loading(int previousAttempts) {
        return new VoiceState(false, List.of(), previousAttempts, true, null);
    }

    public static VoiceState from(ResourceStatus status) {
        return new VoiceState(status.available() && !status.voices().isEmpty(), status.voices(),
                status.attempts(), false, status.lastError());
    }
}
