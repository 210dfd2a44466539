package com.phillippitts.speechmaker.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Normalized, immutable failure descriptor. Created by the error classifier for every handled
 * failure and appended to the diagnostics log.
 *
 * @param id {@code err_<epochMillis>_<random base-36>}
 * @param timestamp creation time
 * @param category normalized category
 * @param severity severity for the UI and health reporting
 * @param userMessage ready-to-display message
 * @param troubleshooting ordered troubleshooting steps
 * @param canRetry whether a retry may succeed; the only input to retry decisions
 * @param suggestedAction remedy for the UI
 * @param code raw error code the record was derived from, may be null
 * @param technicalMessage raw failure message, for logs and diagnostics only
 * @param operation operation that failed, e.g. {@code synthesize}
 */
public record ErrorRecord(
        String id,
        Instant timestamp,
        ErrorCategory category,
        Severity severity,
        String userMessage,
        List<String> troubleshooting,
        boolean canRetry,
        SuggestedAction suggestedAction,
        String code,
        String technicalMessage,
        String operation
) {
    public ErrorRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(userMessage, "userMessage");
        Objects.requireNonNull(suggestedAction, "suggestedAction");
        troubleshooting = troubleshooting == null ? List.of() : List.copyOf(troubleshooting);
    }
}
