package com.phillippitts.speechmaker.service.resource;

import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.config.properties.VoiceEngineProperties;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.ResourceSource;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.VoiceUnavailableException;
import com.phillippitts.speechmaker.service.converter.AudioConverterProbe;
import com.phillippitts.speechmaker.service.engine.VoiceEngine;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorContext;
import com.phillippitts.speechmaker.service.error.RawFailure;
import com.phillippitts.speechmaker.service.retry.RetryPolicy;
import com.phillippitts.speechmaker.util.CancellationToken;
import com.phillippitts.speechmaker.util.Deadline;
import com.phillippitts.speechmaker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single-flight, cached resolution of external capabilities: the audio converter and the voice
 * catalog.
 *
 * <p>Concurrent requests for the same kind share one in-flight probe and then one cached result.
 * The in-flight marker is removed only after the cache write, so a caller arriving in between
 * either joins the running probe or reads the cache; it never starts a second probe.
 *
 * <p>Resolution never throws. Every outcome, including timeouts and exhausted retries, is a
 * definite {@link ResourceStatus}; failures carry a classified {@link ErrorRecord}.
 */
public class ResourceResolver {

    private static final Logger LOG = LogManager.getLogger(ResourceResolver.class);

    static final String VOICE_RETRY_KEY = "voice-catalog";

    private final AudioConverterProbe converterProbe;
    private final VoiceEngine voiceEngine;
    private final ErrorClassifier classifier;
    private final RetryPolicy voiceRetryPolicy;
    private final Executor executor;
    private final ConverterProperties converterProperties;
    private final VoiceEngineProperties engineProperties;
    private final Clock clock;

    private final ConcurrentMap<ResourceKind, ResourceStatus> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<ResourceKind, CompletableFuture<ResourceStatus>> inFlight =
            new ConcurrentHashMap<>();

    public ResourceResolver(AudioConverterProbe converterProbe,
                            VoiceEngine voiceEngine,
                            ErrorClassifier classifier,
                            RetryPolicy voiceRetryPolicy,
                            Executor executor,
                            ConverterProperties converterProperties,
                            VoiceEngineProperties engineProperties) {
        this(converterProbe, voiceEngine, classifier, voiceRetryPolicy, executor,
                converterProperties, engineProperties, Clock.systemUTC());
    }

    public ResourceResolver(AudioConverterProbe converterProbe,
                            VoiceEngine voiceEngine,
                            ErrorClassifier classifier,
                            RetryPolicy voiceRetryPolicy,
                            Executor executor,
                            ConverterProperties converterProperties,
                            VoiceEngineProperties engineProperties,
                            Clock clock) {
        this.converterProbe = Objects.requireNonNull(converterProbe, "converterProbe");
        this.voiceEngine = Objects.requireNonNull(voiceEngine, "voiceEngine");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.voiceRetryPolicy = Objects.requireNonNull(voiceRetryPolicy, "voiceRetryPolicy");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.converterProperties = Objects.requireNonNull(converterProperties, "converterProperties");
        this.engineProperties = Objects.requireNonNull(engineProperties, "engineProperties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ResourceStatus resolve(ResourceKind kind) {
        return resolve(kind, ResolveMode.NORMAL);
    }

    /**
     * Blocking resolution. Returns the cached status when present.
     */
    public ResourceStatus resolve(ResourceKind kind, ResolveMode mode) {
        try {
            return resolveAsync(kind, mode).join();
        } catch (CompletionException e) {
            // probe() converts failures into statuses; reaching here means the executor itself broke
            return failed(kind, e.getCause() != null ? e.getCause() : e, Duration.ZERO);
        }
    }

    public CompletableFuture<ResourceStatus> resolveAsync(ResourceKind kind, ResolveMode mode) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(mode, "mode");

        ResourceStatus cached = cache.get(kind);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<ResourceStatus> fresh = new CompletableFuture<>();
        CompletableFuture<ResourceStatus> running = inFlight.putIfAbsent(kind, fresh);
        if (running != null) {
            LOG.debug("Joining in-flight resolution of {}", kind);
            return running;
        }

        // A probe may have finished between the cache read and the claim.
        cached = cache.get(kind);
        if (cached != null) {
            inFlight.remove(kind, fresh);
            fresh.complete(cached);
            return fresh;
        }

        Runnable task = () -> runProbe(kind, mode, fresh);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.warn("Resource executor rejected probe of {}; running inline", kind);
            task.run();
        }
        return fresh;
    }

    public Optional<ResourceStatus> cached(ResourceKind kind) {
        return Optional.ofNullable(cache.get(kind));
    }

    /** Drops every cached status; the next request probes again. */
    public void clear() {
        cache.clear();
    }

    public void clear(ResourceKind kind) {
        cache.remove(kind);
    }

    private void runProbe(ResourceKind kind, ResolveMode mode, CompletableFuture<ResourceStatus> future) {
        long start = System.nanoTime();
        ResourceStatus status;
        try {
            status = switch (kind) {
                case AUDIO_CONVERTER -> resolveConverter(start);
                case VOICE_CATALOG -> resolveVoices(mode, start);
            };
        } catch (RuntimeException e) {
            status = failed(kind, e, TimeUtils.elapsed(start));
        }
        cache.put(kind, status);
        inFlight.remove(kind, future);
        future.complete(status);
        LOG.info("Resolved {}: available={}, source={}, attempts={}, latency={} ms",
                kind, status.available(), status.source(), status.attempts(),
                status.detectionLatency().toMillis());
    }

    private ResourceStatus resolveConverter(long startNanos) {
        Optional<Path> bundled = converterProbe.bundledCandidate();
        if (bundled.isPresent() && converterProbe.quickValidate(bundled.get())) {
            return ResourceStatus.converterFound(ResourceSource.BUNDLED, bundled.get(),
                    TimeUtils.elapsed(startNanos), clock.instant());
        }
        LOG.debug("No usable bundled converter ({}); probing system PATH", bundled.orElse(null));

        Deadline deadline = Deadline.afterMillis(converterProperties.getDetectionTimeoutMs());
        Optional<Path> onPath = converterProbe.locateOnPath();
        if (onPath.isPresent() && !deadline.isExpired()
                && converterProbe.validate(onPath.get(), deadline.remaining())) {
            return ResourceStatus.converterFound(ResourceSource.SYSTEM, onPath.get(),
                    TimeUtils.elapsed(startNanos), clock.instant());
        }

        String detail = onPath.isEmpty()
                ? "FFmpeg is not installed or not found on PATH"
                : "FFmpeg at " + onPath.get() + " is not installed correctly or did not respond within "
                        + deadline.budget().toMillis() + " ms";
        ErrorRecord error = classifier.classify(RawFailure.of(ErrorCodes.CONVERTER_MISSING, detail),
                ErrorContext.of(ErrorContext.DETECT_CONVERTER));
        return ResourceStatus.converterMissing(TimeUtils.elapsed(startNanos), clock.instant(), error);
    }

    private ResourceStatus resolveVoices(ResolveMode mode, long startNanos) {
        Duration timeout = Duration.ofMillis(mode == ResolveMode.FAST_START
                ? engineProperties.getFastStartListTimeoutMs()
                : engineProperties.getListTimeoutMs());
        ErrorContext context = ErrorContext.of(ErrorContext.LIST_VOICES);

        voiceRetryPolicy.reset(VOICE_RETRY_KEY);
        int calls = 0;
        ErrorRecord lastError = null;
        try {
            while (true) {
                calls++;
                voiceRetryPolicy.nextAttempt(VOICE_RETRY_KEY);
                try {
                    List<Voice> voices = voiceEngine.listVoices(timeout);
                    if (!voices.isEmpty()) {
                        return ResourceStatus.voicesLoaded(voices, calls, TimeUtils.elapsed(startNanos),
                                clock.instant());
                    }
                    lastError = classifier.classify(VoiceUnavailableException.noVoices(), context);
                } catch (RuntimeException e) {
                    lastError = classifier.classify(e, context);
                }

                if (!voiceRetryPolicy.shouldRetry(lastError)
                        || !voiceRetryPolicy.hasAttemptsRemaining(VOICE_RETRY_KEY)) {
                    break;
                }
                LOG.warn("Voice listing attempt {} failed ({}); retrying", calls, lastError.code());
                voiceRetryPolicy.pause(VOICE_RETRY_KEY, CancellationToken.none());
            }
        } catch (ConversionCancelledException e) {
            LOG.warn("Voice listing interrupted after {} attempts", calls);
        } finally {
            voiceRetryPolicy.reset(VOICE_RETRY_KEY);
        }
        LOG.warn("Voice catalog unavailable after {} attempts: {}", calls,
                lastError != null ? lastError.code() : "interrupted");
        return ResourceStatus.voicesUnavailable(calls, TimeUtils.elapsed(startNanos), clock.instant(), lastError);
    }

    private ResourceStatus failed(ResourceKind kind, Throwable error, Duration latency) {
        String operation = kind == ResourceKind.AUDIO_CONVERTER
                ? ErrorContext.DETECT_CONVERTER : ErrorContext.LIST_VOICES;
        ErrorRecord record = classifier.classify(error, ErrorContext.of(operation));
        return kind == ResourceKind.AUDIO_CONVERTER
                ? ResourceStatus.converterMissing(latency, clock.instant(), record)
                : ResourceStatus.voicesUnavailable(0, latency, clock.instant(), record);
    }
}
