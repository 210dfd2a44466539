package com.phillippitts.speechmaker.service.error;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a failure happened. The operation takes part in classification (the same converter error
 * suggests a different remedy during detection than during conversion); file and voice only shape
 * the user message.
 *
 * @param operation failing operation, one of the constants below
 * @param filePath file involved, may be null
 * @param voiceId voice involved, may be null
 */
public record ErrorContext(String operation, Path filePath, String voiceId) {

    public static final String READ_FILE = "read_file";
    public static final String LIST_VOICES = "list_voices";
    public static final String SYNTHESIZE = "synthesize";
    public static final String DETECT_CONVERTER = "detect_converter";
    public static final String TRANSCODE = "transcode";
    public static final String MERGE = "merge";
    public static final String CLEANUP = "cleanup";
    public static final String CONVERT = "convert";

    public ErrorContext {
        Objects.requireNonNull(operation, "operation");
    }

    public static ErrorContext of(String operation) {
        return new ErrorContext(operation, null, null);
    }

    public ErrorContext withFile(Path file) {
        return new ErrorContext(operation, file, voiceId);
    }

    public ErrorContext withVoice(String voice) {
        return new ErrorContext(operation, filePath, voice);
    }
}
