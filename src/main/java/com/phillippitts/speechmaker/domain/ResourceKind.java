package com.phillippitts.speechmaker.domain;

/**
 * External capabilities resolved at runtime.
 */
public enum ResourceKind {
    /** ffmpeg: optional, gates MP3 output only. */
    AUDIO_CONVERTER,
    /** Voices offered by the synthesis engine: required for readiness. */
    VOICE_CATALOG
}
