package com.phillippitts.speechmaker.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of text to synthesize. The index is the stable ordering key used for the merge,
 * independent of the order in which chunks complete.
 *
 * <p>Thread-safe: a worker mutates the job while the session thread and HTTP readers observe it.
 * Illegal transitions throw {@link IllegalStateException}.
 */
public final class ChunkJob {

    private final int index;
    private final String text;

    private ChunkStatus status = ChunkStatus.PENDING;
    private int attemptCount;
    private Path outputPath;
    private ErrorRecord lastError;

    public ChunkJob(int index, String text) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        this.index = index;
        this.text = Objects.requireNonNull(text, "text");
    }

    /** PENDING -> IN_PROGRESS, counting one more attempt. */
    public synchronized void start() {
        require(ChunkStatus.PENDING, "start");
        status = ChunkStatus.IN_PROGRESS;
        attemptCount++;
    }

    /** IN_PROGRESS -> SUCCEEDED. */
    public synchronized void succeed(Path output) {
        require(ChunkStatus.IN_PROGRESS, "succeed");
        this.outputPath = Objects.requireNonNull(output, "output");
        this.lastError = null;
        status = ChunkStatus.SUCCEEDED;
    }

    /** IN_PROGRESS -> FAILED. */
    public synchronized void fail(ErrorRecord error) {
        require(ChunkStatus.IN_PROGRESS, "fail");
        this.lastError = Objects.requireNonNull(error, "error");
        status = ChunkStatus.FAILED;
    }

    /** FAILED -> PENDING (scheduled retry). */
    public synchronized void requeue() {
        require(ChunkStatus.FAILED, "requeue");
        status = ChunkStatus.PENDING;
    }

    private void require(ChunkStatus expected, String operation) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + operation + " chunk " + index + " in state " + status);
        }
    }

    public int getIndex() {
        return index;
    }

    public String getText() {
        return text;
    }

    public synchronized ChunkStatus getStatus() {
        return status;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /** Path of the synthesized chunk file; null until the chunk succeeds. */
    public synchronized Path getOutputPath() {
        return outputPath;
    }

    public synchronized ErrorRecord getLastError() {
        return lastError;
    }

    @Override
    public synchronized String toString() {
        return "ChunkJob{index=" + index + ", chars=" + text.length() + ", status=" + status
                + ", attempts=" + attemptCount + '}';
    }
}
