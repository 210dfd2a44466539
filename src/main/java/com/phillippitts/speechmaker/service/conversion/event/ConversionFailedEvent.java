package com.phillippitts.speechmaker.service.conversion.event;

import com.phillippitts.speechmaker.domain.ErrorRecord;

import java.time.Instant;

/**
 * Emitted once when a session ends FAILED or CANCELLED.
 *
 * @param sessionId session that ended
 * @param error classified reason; category CANCELLED for cancellations
 * @param timestamp when the session ended
 */
public record ConversionFailedEvent(
        String sessionId,
        ErrorRecord error,
        Instant timestamp
) {}
