package com.phillippitts.speechmaker.util;

import java.time.Duration;

/**
 * Timeouts for subprocess and stream-reader lifecycle management in
 * {@link com.phillippitts.speechmaker.service.process.ProcessRunner}.
 */
public final class ProcessTimeouts {

    /** Stream readers get this long to flush buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of stream readers after a kill; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
