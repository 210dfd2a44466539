package com.phillippitts.speechmaker.domain;

import java.util.Locale;

/**
 * Audio container of the final artifact or of the voice engine's chunk files. Choosing MP3 for the
 * artifact requires the audio converter; WAV can always be produced, in-process if need be.
 */
public enum OutputFormat {
    WAV("wav"),
    MP3("mp3");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Parses "wav"/"mp3" case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OutputFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Output format must not be blank");
        }
        return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
