package com.phillippitts.speechmaker.exception;

/**
 * Thrown when an external tool (voice engine or audio converter) fails to start, exits non-zero,
 * produces no output or exceeds its timeout. Prefer {@link ExternalProcessExceptionBuilder}.
 */
public class ExternalProcessException extends SpeechMakerException {

    private final String tool;
    private final Integer exitCode;

    public ExternalProcessException(String message, String errorCode, String tool, Integer exitCode,
                                    Throwable cause) {
        super(message + " (tool: " + tool + ")", errorCode, cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    /** Exit code, or null when the process never exited on its own. */
    public Integer getExitCode() {
        return exitCode;
    }
}
