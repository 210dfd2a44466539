package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.domain.ChunkJob;
import com.phillippitts.speechmaker.domain.ConversionSession;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.exception.SessionFailedException;
import com.phillippitts.speechmaker.service.conversion.event.ConversionCompletedEvent;
import com.phillippitts.speechmaker.service.conversion.event.ConversionFailedEvent;
import com.phillippitts.speechmaker.service.conversion.event.ConversionPhase;
import com.phillippitts.speechmaker.service.conversion.event.ConversionProgressEvent;
import com.phillippitts.speechmaker.service.converter.AudioConverter;
import com.phillippitts.speechmaker.service.converter.WavConcatenator;
import com.phillippitts.speechmaker.service.engine.VoiceEngine;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorContext;
import com.phillippitts.speechmaker.service.metrics.ConversionMetrics;
import com.phillippitts.speechmaker.service.retry.RetryPolicy;
import com.phillippitts.speechmaker.util.CancellationToken;
import com.phillippitts.speechmaker.util.LogSanitizer;
import com.phillippitts.speechmaker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Default {@link ConversionOrchestrator}: bounded-concurrency chunk synthesis, ordered merge,
 * optional MP3 transcode.
 *
 * <p><b>Thread Model:</b> the calling thread is the session's control thread. It dispatches chunk
 * jobs in index order onto the shared {@code conversionExecutor}, holding a per-session
 * {@link Semaphore} permit per running chunk, so one session never has more than
 * {@code maxConcurrentChunks} engine processes. Retries run inside the worker that owns the
 * chunk, after the policy's backoff.
 *
 * <p><b>Ordering:</b> chunks may finish in any order. Each result lands in its index slot, and the
 * merge reads the slots in index order.
 *
 * <p><b>Failure Handling:</b>
 * <ul>
 *   <li>Terminal chunk failure: dispatching stops, running chunks finish, the session fails with the
 *       first terminal error. Chunk files are kept for the caller to discard.</li>
 *   <li>Merge or transcode failure: classified with its operation; chunk files are removed.</li>
 *   <li>Cancellation: the token stops dispatching, backoffs and running processes; chunk files are
 *       removed and the session ends CANCELLED.</li>
 * </ul>
 */
public class DefaultConversionOrchestrator implements ConversionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultConversionOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String MERGED_WAV_NAME = "merged.wav";

    private static final int SYNTH_PERCENT_START = 20;
    private static final int SYNTH_PERCENT_SPAN = 60;
    private static final int MERGE_PERCENT = 85;
    private static final int TRANSCODE_PERCENT = 90;
    private static final int COMPLETE_PERCENT = 100;

    private final VoiceEngine voiceEngine;
    private final AudioConverter audioConverter;
    private final WavConcatenator wavConcatenator;
    private final ErrorClassifier classifier;
    private final RetryPolicy chunkRetryPolicy;
    private final Executor executor;
    private final ChunkFileCleaner cleaner;
    private final ApplicationEventPublisher publisher;
    private final ConversionMetrics metrics;
    private final int maxConcurrentChunks;
    private final Clock clock;
    private final OutputFormat chunkFormat;

    public DefaultConversionOrchestrator(VoiceEngine voiceEngine,
                                         AudioConverter audioConverter,
                                         WavConcatenator wavConcatenator,
                                         ErrorClassifier classifier,
                                         RetryPolicy chunkRetryPolicy,
                                         Executor executor,
                                         ChunkFileCleaner cleaner,
                                         ApplicationEventPublisher publisher,
                                         ConversionMetrics metrics,
                                         int maxConcurrentChunks,
                                         Clock clock) {
        this.voiceEngine = Objects.requireNonNull(voiceEngine, "voiceEngine");
        this.audioConverter = Objects.requireNonNull(audioConverter, "audioConverter");
        this.wavConcatenator = Objects.requireNonNull(wavConcatenator, "wavConcatenator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.chunkRetryPolicy = Objects.requireNonNull(chunkRetryPolicy, "chunkRetryPolicy");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (maxConcurrentChunks < 1) {
            throw new IllegalArgumentException("maxConcurrentChunks must be >= 1");
        }
        this.maxConcurrentChunks = maxConcurrentChunks;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.chunkFormat = Objects.requireNonNull(voiceEngine.audioFormat(), "voiceEngine.audioFormat()");
    }

    @Override
    public Path convert(ConversionSession session) {
        Objects.requireNonNull(session, "session");
        if (!session.markRunning()) {
            throw new IllegalStateException("Session " + session.getId() + " is " + session.getStatus());
        }

        long startNanos = System.nanoTime();
        String previousSessionId = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, session.getId());
        try {
            LOG.info("Starting conversion: chunks={}, voice={}, speed={}, format={}",
                    session.getJobs().size(), session.getVoiceId(), session.getSpeed(), session.getOutputFormat());
            return run(session, startNanos);
        } finally {
            chunkRetryPolicy.resetAll(session.getId() + ":");
            if (previousSessionId == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previousSessionId);
            }
        }
    }

    private Path run(ConversionSession session, long startNanos) {
        CancellationToken token = session.getCancellationToken();
        try {
            Files.createDirectories(session.getWorkDir());
        } catch (IOException e) {
            throw fail(session, classifier.classify(e,
                    ErrorContext.of(ErrorContext.CONVERT).withFile(session.getWorkDir())), e, startNanos);
        }

        progress(session, ConversionPhase.SYNTHESIZING, 0, SYNTH_PERCENT_START);
        SessionRun run = new SessionRun(session);
        dispatch(run);

        if (token.isCancelled()) {
            throw cancelled(run, null, startNanos);
        }
        if (run.terminalFailure() != null) {
            LOG.warn("Session failed at synthesis: {} of {} chunks succeeded, category={}",
                    run.slots.filledCount(), run.slots.size(), run.terminalFailure().category());
            throw fail(session, run.terminalFailure(), run.terminalCause(), startNanos);
        }

        Path output;
        try {
            output = assemble(session, run.slots.inOrder(), token);
        } catch (ConversionCancelledException e) {
            throw cancelled(run, e, startNanos);
        } catch (StageFailure e) {
            if (token.isCancelled()) {
                throw cancelled(run, e.getCause(), startNanos);
            }
            cleaner.cleanup(session.getJobs(), session.getWorkDir());
            throw fail(session, e.record, e.getCause(), startNanos);
        }

        cleaner.cleanup(session.getJobs(), session.getWorkDir());
        long durationMs = TimeUtils.elapsedMillis(startNanos);
        if (session.complete(output, clock.instant())) {
            progress(session, ConversionPhase.COMPLETE, run.slots.size(), COMPLETE_PERCENT);
            metrics.recordSession("succeeded", System.nanoTime() - startNanos);
            publisher.publishEvent(new ConversionCompletedEvent(session.getId(), output,
                    session.getJobs().size(), durationMs, clock.instant()));
            LOG.info("Conversion complete: output={}, chunks={}, durationMs={}",
                    output.getFileName(), session.getJobs().size(), durationMs);
        }
        return output;
    }

    /**
     * Dispatches jobs in index order, at most {@code maxConcurrentChunks} at a time, and waits for
     * every dispatched job to settle.
     */
    private void dispatch(SessionRun run) {
        CancellationToken token = run.session.getCancellationToken();
        Semaphore permits = new Semaphore(maxConcurrentChunks);
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        try {
            for (ChunkJob job : run.session.getJobs()) {
                if (run.shouldStop()) {
                    break;
                }
                permits.acquire();
                if (run.shouldStop()) {
                    permits.release();
                    break;
                }
                try {
                    inFlight.add(CompletableFuture.runAsync(() -> {
                        try {
                            runChunk(run, job);
                        } finally {
                            permits.release();
                        }
                    }, executor));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    LOG.warn("Chunk {} rejected by the conversion executor: {}", job.getIndex(), e.getMessage());
                    run.recordTerminal(classifier.classify(e, ErrorContext.of(ErrorContext.SYNTHESIZE)), e);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        }

        try {
            CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            // runChunk records its own failures; anything escaping it is a bug worth failing on
            run.recordTerminal(classifier.classify(e.getCause(), ErrorContext.of(ErrorContext.SYNTHESIZE)),
                    e.getCause());
        }
        if (!token.isCancelled() && run.terminalFailure() == null && !run.slots.isComplete()) {
            throw new IllegalStateException("Dispatch finished with " + run.slots.filledCount()
                    + " of " + run.slots.size() + " chunks");
        }
    }

    /**
     * Synthesizes one chunk, retrying retryable failures while attempts remain.
     */
    private void runChunk(SessionRun run, ChunkJob job) {
        ConversionSession session = run.session;
        CancellationToken token = session.getCancellationToken();
        String retryKey = session.getId() + ":" + job.getIndex();
        Path target = session.getWorkDir().resolve("chunk_" + job.getIndex() + "." + chunkFormat.extension());
        ErrorContext context = ErrorContext.of(ErrorContext.SYNTHESIZE).withVoice(session.getVoiceId());

        while (!run.shouldStop()) {
            job.start();
            try {
                Path written = voiceEngine.synthesize(job.getText(), session.getVoiceId(), session.getSpeed(),
                        target, token);
                job.succeed(written);
                run.slots.fill(job.getIndex(), written);
                chunkRetryPolicy.reset(retryKey);
                metrics.incrementChunk("succeeded");
                int done = run.slots.filledCount();
                progress(session, ConversionPhase.SYNTHESIZING, done,
                        SYNTH_PERCENT_START + SYNTH_PERCENT_SPAN * done / run.slots.size());
                LOG.debug("Chunk {} synthesized on attempt {}", job.getIndex(), job.getAttemptCount());
                return;
            } catch (RuntimeException e) {
                if (token.isCancelled() || e instanceof ConversionCancelledException) {
                    job.fail(run.cancellationRecord());
                    metrics.incrementChunk("cancelled");
                    return;
                }
                ErrorRecord record = classifier.classify(e, context);
                job.fail(record);
                chunkRetryPolicy.nextAttempt(retryKey);

                if (chunkRetryPolicy.shouldRetry(record) && chunkRetryPolicy.hasAttemptsRemaining(retryKey)
                        && !run.shouldStop()) {
                    LOG.warn("Chunk {} failed on attempt {} ({}); retrying", job.getIndex(),
                            job.getAttemptCount(), record.code());
                    job.requeue();
                    metrics.incrementRetry();
                    try {
                        chunkRetryPolicy.pause(retryKey, token);
                    } catch (ConversionCancelledException cancelled) {
                        return;
                    }
                    continue;
                }

                LOG.warn("Chunk {} failed terminally after {} attempts: category={}, text={}",
                        job.getIndex(), job.getAttemptCount(), record.category(),
                        LogSanitizer.preview(job.getText()));
                metrics.incrementChunk("failed");
                run.recordTerminal(record, e);
                return;
            }
        }
    }

    /**
     * Produces the final artifact from the ordered chunk files.
     *
     * <p>A single chunk already in the requested container is moved into place. Otherwise the chunks
     * become one PCM WAV (by the converter when available, else in-process, decoding MPEG chunks),
     * which is the artifact for WAV output and the transcode input for MP3 output.
     */
    private Path assemble(ConversionSession session, List<Path> ordered, CancellationToken token) {
        token.throwIfCancelled("merge");
        OutputFormat target = session.getOutputFormat();
        if (ordered.size() == 1 && chunkFormat == target) {
            try {
                Files.move(ordered.get(0), session.getOutputPath(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StageFailure(classifier.classify(e,
                        ErrorContext.of(ErrorContext.MERGE).withFile(session.getOutputPath())), e);
            }
            return session.getOutputPath();
        }

        boolean mp3 = target == OutputFormat.MP3;
        Path wavTarget = mp3 ? session.getWorkDir().resolve(MERGED_WAV_NAME) : session.getOutputPath();
        boolean converter = audioConverter.isAvailable();
        String operation = ErrorContext.MERGE;
        try {
            if (ordered.size() > 1) {
                progress(session, ConversionPhase.MERGING, ordered.size(), MERGE_PERCENT);
            }
            if (ordered.size() == 1 && chunkFormat == OutputFormat.WAV) {
                Files.move(ordered.get(0), wavTarget, StandardCopyOption.REPLACE_EXISTING);
            } else if (converter && ordered.size() == 1) {
                operation = ErrorContext.TRANSCODE;
                audioConverter.transcode(ordered.get(0), wavTarget, OutputFormat.WAV, token);
            } else if (converter) {
                audioConverter.merge(ordered, wavTarget, token);
            } else {
                LOG.info("Audio converter unavailable; assembling {} {} chunk(s) in-process",
                        ordered.size(), chunkFormat);
                wavConcatenator.concat(ordered, wavTarget);
            }
        } catch (ConversionCancelledException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new StageFailure(classifier.classify(e,
                    ErrorContext.of(operation).withFile(wavTarget)), e);
        }

        if (!mp3) {
            return wavTarget;
        }

        token.throwIfCancelled("transcode");
        progress(session, ConversionPhase.TRANSCODING, ordered.size(), TRANSCODE_PERCENT);
        try {
            audioConverter.transcode(wavTarget, session.getOutputPath(), OutputFormat.MP3, token);
        } catch (ConversionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageFailure(classifier.classify(e,
                    ErrorContext.of(ErrorContext.TRANSCODE).withFile(wavTarget)), e);
        }
        try {
            Files.deleteIfExists(wavTarget);
        } catch (IOException e) {
            classifier.classify(e, ErrorContext.of(ErrorContext.CLEANUP).withFile(wavTarget));
            LOG.warn("Could not delete intermediate WAV {}: {}", wavTarget, e.toString());
        }
        return session.getOutputPath();
    }

    private SessionFailedException fail(ConversionSession session, ErrorRecord record, Throwable cause,
                                        long startNanos) {
        if (session.fail(record, clock.instant())) {
            metrics.recordSession("failed", System.nanoTime() - startNanos);
            publisher.publishEvent(new ConversionFailedEvent(session.getId(), record, clock.instant()));
        }
        return new SessionFailedException(session.getId(), record, session.getJobs(), cause);
    }

    private SessionFailedException cancelled(SessionRun run, Throwable cause, long startNanos) {
        ConversionSession session = run.session;
        ErrorRecord record = run.cancellationRecord();
        cleaner.cleanup(session.getJobs(), session.getWorkDir());
        if (session.cancel(record, clock.instant())) {
            metrics.recordSession("cancelled", System.nanoTime() - startNanos);
            publisher.publishEvent(new ConversionFailedEvent(session.getId(), record, clock.instant()));
            LOG.info("Conversion cancelled after {} of {} chunks", run.slots.filledCount(), run.slots.size());
        }
        return new SessionFailedException(session.getId(), record, session.getJobs(), cause);
    }

    private void progress(ConversionSession session, ConversionPhase phase, int completed, int percent) {
        publisher.publishEvent(new ConversionProgressEvent(session.getId(), phase, completed,
                session.getJobs().size(), percent));
    }

    /**
     * Mutable state of one {@link #convert} call, shared between the control thread and workers.
     */
    private final class SessionRun {
        private final ConversionSession session;
        private final ChunkResultSlots slots;
        private ErrorRecord terminal;
        private Throwable terminalCause;
        private ErrorRecord cancelRecord;

        SessionRun(ConversionSession session) {
            this.session = session;
            this.slots = new ChunkResultSlots(session.getJobs().size());
        }

        synchronized boolean shouldStop() {
            return terminal != null || session.getCancellationToken().isCancelled();
        }

        /** Keeps the first terminal failure only. */
        synchronized void recordTerminal(ErrorRecord record, Throwable cause) {
            if (terminal == null) {
                terminal = record;
                terminalCause = cause;
            }
        }

        synchronized ErrorRecord terminalFailure() {
            return terminal;
        }

        synchronized Throwable terminalCause() {
            return terminalCause;
        }

        /** One CANCELLED record per session, however many workers observe the cancellation. */
        synchronized ErrorRecord cancellationRecord() {
            if (cancelRecord == null) {
                cancelRecord = classifier.classify(new ConversionCancelledException("conversion"),
                        ErrorContext.of(ErrorContext.CONVERT));
            }
            return cancelRecord;
        }
    }

    /** Merge or transcode failure, already classified. */
    private static final class StageFailure extends RuntimeException {
        private final transient ErrorRecord record;

        StageFailure(ErrorRecord record, Throwable cause) {
            super(record.userMessage(), cause);
            this.record = record;
        }
    }
}
