package com.phillippitts.speechmaker.exception;

/**
 * Base exception for all SpeechMaker application-specific errors.
 * Carries an optional raw error code (see {@link ErrorCodes}) for the error classifier.
 */
public class SpeechMakerException extends RuntimeException {

    private final String errorCode;

    public SpeechMakerException(String message) {
        this(message, null, null);
    }

    public SpeechMakerException(String message, String errorCode) {
        this(message, errorCode, null);
    }

    public SpeechMakerException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Raw error code, or null when the failure has none. */
    public String getErrorCode() {
        return errorCode;
    }
}
