package com.phillippitts.speechmaker.service.conversion.event;

/**
 * Emitted as a session advances.
 *
 * @param sessionId session the progress belongs to
 * @param phase current phase
 * @param completedChunks chunks synthesized so far
 * @param totalChunks chunks in the session
 * @param percent overall progress, 0-100
 */
public record ConversionProgressEvent(
        String sessionId,
        ConversionPhase phase,
        int completedChunks,
        int totalChunks,
        int percent
) {}
