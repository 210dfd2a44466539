package com.phillippitts.speechmaker.exception;

/**
 * Raw error codes understood by the error classifier. The file system codes mirror the POSIX names
 * so that codes coming from different layers classify the same way.
 */
public final class ErrorCodes {

    public static final String ENOENT = "ENOENT";
    public static final String EACCES = "EACCES";
    public static final String EPERM = "EPERM";
    public static final String EISDIR = "EISDIR";
    public static final String EMFILE = "EMFILE";
    public static final String ENFILE = "ENFILE";

    public static final String VOICES_EMPTY = "VOICES_EMPTY";
    public static final String VOICE_NOT_FOUND = "VOICE_NOT_FOUND";
    public static final String ENGINE_START_FAILED = "ENGINE_START_FAILED";
    public static final String ENGINE_TIMEOUT = "ENGINE_TIMEOUT";
    public static final String SYNTHESIS_FAILED = "SYNTHESIS_FAILED";

    public static final String CONVERTER_MISSING = "CONVERTER_MISSING";
    public static final String CONVERTER_TIMEOUT = "CONVERTER_TIMEOUT";
    public static final String TRANSCODE_FAILED = "TRANSCODE_FAILED";
    public static final String MERGE_FAILED = "MERGE_FAILED";

    public static final String EMPTY_INPUT = "EMPTY_INPUT";
    public static final String UNSUPPORTED_FILE_TYPE = "UNSUPPORTED_FILE_TYPE";
    public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
    public static final String OUTPUT_PATH = "OUTPUT_PATH";
    public static final String CANCELLED = "CANCELLED";
    public static final String NOT_READY = "NOT_READY";

    private ErrorCodes() {
    }
}
