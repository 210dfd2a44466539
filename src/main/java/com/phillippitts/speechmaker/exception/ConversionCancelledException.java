package com.phillippitts.speechmaker.exception;

/**
 * Thrown when a session's cancellation signal is observed.
 */
public class ConversionCancelledException extends SpeechMakerException {

    public ConversionCancelledException(String operation) {
        super("Conversion was cancelled during " + operation, ErrorCodes.CANCELLED);
    }
}
