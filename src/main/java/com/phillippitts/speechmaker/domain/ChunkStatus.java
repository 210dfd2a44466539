package com.phillippitts.speechmaker.domain;

/**
 * Lifecycle of a {@link ChunkJob}: {@code PENDING -> IN_PROGRESS -> SUCCEEDED | FAILED}, and
 * {@code FAILED -> PENDING} when a retry is scheduled.
 */
public enum ChunkStatus {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED
}
