package com.phillippitts.speechmaker.presentation.controller;

import com.phillippitts.speechmaker.domain.ChunkJob;
import com.phillippitts.speechmaker.domain.ConversionSession;
import com.phillippitts.speechmaker.domain.ErrorRecord;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a session for API clients.
 */
record SessionView(
        String id,
        String status,
        String voiceId,
        double speed,
        String outputFormat,
        String outputPath,
        int totalChunks,
        int completedChunks,
        List<ChunkView> chunks,
        ErrorRecord error,
        Instant createdAt,
        Instant finishedAt
) {
    record ChunkView(int index, int chars, String status, int attempts, String errorCategory) {
        static ChunkView of(ChunkJob job) {
            ErrorRecord error = job.getLastError();
            return new ChunkView(job.getIndex(), job.getText().length(), job.getStatus().name(),
                    job.getAttemptCount(), error == null ? null : error.category().name());
        }
    }

    static SessionView of(ConversionSession session) {
        return new SessionView(
                session.getId(),
                session.getStatus().name(),
                session.getVoiceId(),
                session.getSpeed(),
                session.getOutputFormat().extension(),
                session.getOutputPath().toString(),
                session.getJobs().size(),
                session.completedChunks(),
                session.getJobs().stream().map(ChunkView::of).toList(),
                session.getError(),
                session.getCreatedAt(),
                session.getFinishedAt());
    }
}
