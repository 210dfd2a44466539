package com.phillippitts.speechmaker.exception;

/**
 * Thrown when source text or a source file is rejected: empty text, wrong file type, file too large.
 */
public class InvalidInputException extends SpeechMakerException {

    public InvalidInputException(String message, String errorCode) {
        super(message, errorCode);
    }

    public static InvalidInputException emptyText() {
        return new InvalidInputException("Text cannot be empty", ErrorCodes.EMPTY_INPUT);
    }
}
