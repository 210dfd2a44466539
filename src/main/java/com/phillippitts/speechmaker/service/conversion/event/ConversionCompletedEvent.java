package com.phillippitts.speechmaker.service.conversion.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Emitted once when a session produced its output file.
 *
 * @param sessionId finished session
 * @param outputPath final artifact
 * @param totalChunks number of chunks merged
 * @param durationMs wall time of the session
 * @param timestamp when the session completed
 */
public record ConversionCompletedEvent(
        String sessionId,
        Path outputPath,
        int totalChunks,
        long durationMs,
        Instant timestamp
) {}
