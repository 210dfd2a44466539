package com.phillippitts.speechmaker.domain;

import com.phillippitts.speechmaker.util.CancellationToken;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One conversion request in flight: its chunk jobs, parameters, cancellation signal and outcome.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * PENDING → RUNNING (via markRunning)
 * PENDING | RUNNING → SUCCEEDED | FAILED | CANCELLED (via complete / fail / cancel)
 * </pre>
 * A session becomes terminal exactly once. Later terminal transitions return {@code false} and
 * change nothing, so a cancellation racing a successful merge cannot overwrite the result.
 */
public final class ConversionSession {

    private final String id;
    private final List<ChunkJob> jobs;
    private final String voiceId;
    private final double speed;
    private final OutputFormat outputFormat;
    private final Path outputPath;
    private final Path workDir;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();

    private final Lock lock = new ReentrantLock();
    private SessionStatus status = SessionStatus.PENDING;
    private Path result;
    private ErrorRecord error;
    private Instant finishedAt;

    public ConversionSession(String id, List<ChunkJob> jobs, String voiceId, double speed,
                             OutputFormat outputFormat, Path outputPath, Path workDir, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        if (jobs == null || jobs.isEmpty()) {
            throw new IllegalArgumentException("A session needs at least one chunk");
        }
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Chunk jobs must be ordered by index, found "
                        + jobs.get(i).getIndex() + " at position " + i);
            }
        }
        this.jobs = List.copyOf(jobs);
        this.voiceId = Objects.requireNonNull(voiceId, "voiceId");
        this.speed = speed;
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Creates a session with a random id and one PENDING job per chunk. Chunk files go to
     * {@code <workRoot>/session-<id>}.
     */
    public static ConversionSession create(List<String> chunks, String voiceId, double speed,
                                           OutputFormat outputFormat, Path outputPath, Path workRoot,
                                           Instant now) {
        List<ChunkJob> jobs = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            jobs.add(new ChunkJob(i, chunks.get(i)));
        }
        String id = UUID.randomUUID().toString();
        return new ConversionSession(id, jobs, voiceId, speed, outputFormat, outputPath,
                workRoot.resolve("session-" + id), now);
    }

    /** PENDING → RUNNING. */
    public boolean markRunning() {
        lock.lock();
        try {
            if (status != SessionStatus.PENDING) {
                return false;
            }
            status = SessionStatus.RUNNING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean complete(Path output, Instant now) {
        Objects.requireNonNull(output, "output");
        return finish(SessionStatus.SUCCEEDED, output, null, now);
    }

    public boolean fail(ErrorRecord failure, Instant now) {
        Objects.requireNonNull(failure, "failure");
        return finish(SessionStatus.FAILED, null, failure, now);
    }

    /**
     * Marks the session CANCELLED. Does not signal the token; see {@link #requestCancel()}.
     */
    public boolean cancel(ErrorRecord reason, Instant now) {
        return finish(SessionStatus.CANCELLED, null, reason, now);
    }

    /**
     * Signals cancellation to every worker and external process of the session.
     *
     * @return true if this call signalled it
     */
    public boolean requestCancel() {
        if (isTerminal()) {
            return false;
        }
        return cancellationToken.cancel();
    }

    private boolean finish(SessionStatus target, Path output, ErrorRecord failure, Instant now) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            status = target;
            result = output;
            error = failure;
            finishedAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public String getId() {
        return id;
    }

    public List<ChunkJob> getJobs() {
        return jobs;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public double getSpeed() {
        return speed;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    /** Requested final artifact path. */
    public Path getOutputPath() {
        return outputPath;
    }

    /** Scratch directory for chunk files. */
    public Path getWorkDir() {
        return workDir;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public SessionStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }

    /** Final artifact; null unless SUCCEEDED. */
    public Path getResult() {
        lock.lock();
        try {
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Failure or cancellation record; null unless FAILED or CANCELLED. */
    public ErrorRecord getError() {
        lock.lock();
        try {
            return error;
        } finally {
            lock.unlock();
        }
    }

    public Instant getFinishedAt() {
        lock.lock();
        try {
            return finishedAt;
        } finally {
            lock.unlock();
        }
    }

    public int completedChunks() {
        int n = 0;
        for (ChunkJob job : jobs) {
            if (job.getStatus() == ChunkStatus.SUCCEEDED) {
                n++;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        return "ConversionSession{id=" + id + ", chunks=" + jobs.size() + ", voice=" + voiceId
                + ", format=" + outputFormat + ", status=" + getStatus() + '}';
    }
}
