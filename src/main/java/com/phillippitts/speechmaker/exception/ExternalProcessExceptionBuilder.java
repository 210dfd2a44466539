package com.phillippitts.speechmaker.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalProcessException} with contextual details.
 *
 * <pre>
 * throw ExternalProcessExceptionBuilder.create("Synthesis failed")
 *         .tool("edge-tts")
 *         .code(ErrorCodes.SYNTHESIS_FAILED)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>Message format: {@code {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...)}.
 */
public final class ExternalProcessExceptionBuilder {

    private final String message;
    private String tool;
    private String code;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalProcessExceptionBuilder(String message) {
        this.message = message;
    }

    public static ExternalProcessExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalProcessExceptionBuilder(message);
    }

    public ExternalProcessExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    /** Raw error code from {@link ErrorCodes}. */
    public ExternalProcessExceptionBuilder code(String code) {
        this.code = code;
        return this;
    }

    public ExternalProcessExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalProcessExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ExternalProcessExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Null keys and values are ignored. */
    public ExternalProcessExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ExternalProcessException build() {
        return new ExternalProcessException(buildDetailedMessage(), code,
                tool != null ? tool : "unknown", exitCode, cause);
    }

    private String buildDetailedMessage() {
        if (exitCode == null && durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
