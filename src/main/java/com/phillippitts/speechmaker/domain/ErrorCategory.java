package com.phillippitts.speechmaker.domain;

/**
 * Normalized failure categories produced by the error classifier.
 */
public enum ErrorCategory {
    VOICE_UNAVAILABLE,
    ENGINE_UNRESPONSIVE,
    FILE_NOT_FOUND,
    ACCESS_DENIED,
    IS_DIRECTORY,
    TOO_MANY_OPEN_FILES,
    UNSUPPORTED_FILE_TYPE,
    FILE_TOO_LARGE,
    EMPTY_INPUT,
    CONVERTER_MISSING,
    CONVERSION_FAILED,
    MERGE_FAILED,
    OUTPUT_LOCATION,
    CANCELLED,
    CLEANUP,
    UNKNOWN
}
