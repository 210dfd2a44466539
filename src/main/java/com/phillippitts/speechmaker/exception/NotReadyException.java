package com.phillippitts.speechmaker.exception;

/**
 * Thrown when a conversion is requested before the application is ready
 * (still initializing, no voices loaded, or no output folder).
 */
public class NotReadyException extends SpeechMakerException {

    public NotReadyException(String statusMessage) {
        super("Not ready to convert: " + statusMessage, ErrorCodes.NOT_READY);
    }
}
