package com.phillippitts.speechmaker.exception;

/**
 * Thrown when an operation needs the audio converter (MP3 output) and none was found.
 */
public class ConverterUnavailableException extends SpeechMakerException {

    public ConverterUnavailableException(String operation) {
        super("FFmpeg is not installed or not found; cannot " + operation, ErrorCodes.CONVERTER_MISSING);
    }
}
