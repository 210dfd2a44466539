package com.phillippitts.speechmaker.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of an external capability. Shared read-only once resolution completes.
 *
 * @param kind resolved capability
 * @param available whether the capability can be used
 * @param source where it was found
 * @param location executable path for the converter; null otherwise
 * @param detectionLatency time spent resolving
 * @param cachedAt when the snapshot was produced
 * @param voices voice catalog (empty for the converter)
 * @param attempts number of probe attempts made
 * @param lastError last classified failure, null on clean success
 */
public record ResourceStatus(
        ResourceKind kind,
        boolean available,
        ResourceSource source,
        Path location,
        Duration detectionLatency,
        Instant cachedAt,
        List<Voice> voices,
        int attempts,
        ErrorRecord lastError
) {
    public ResourceStatus {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detectionLatency, "detectionLatency");
        Objects.requireNonNull(cachedAt, "cachedAt");
        voices = voices == null ? List.of() : List.copyOf(voices);
    }

    public static ResourceStatus converterFound(ResourceSource source, Path location,
                                                Duration latency, Instant now) {
        return new ResourceStatus(ResourceKind.AUDIO_CONVERTER, true, source, location, latency, now,
                List.of(), 1, null);
    }

    public static ResourceStatus converterMissing(Duration latency, Instant now, ErrorRecord error) {
        return new ResourceStatus(ResourceKind.AUDIO_CONVERTER, false, ResourceSource.NONE, null, latency, now,
                List.of(), 1, error);
    }

    public static ResourceStatus voicesLoaded(List<Voice> voices, int attempts, Duration latency, Instant now) {
        return new ResourceStatus(ResourceKind.VOICE_CATALOG, true, ResourceSource.ENGINE, null, latency, now,
                voices, attempts, null);
    }

    public static ResourceStatus voicesUnavailable(int attempts, Duration latency, Instant now, ErrorRecord error) {
        return new ResourceStatus(ResourceKind.VOICE_CATALOG, false, ResourceSource.NONE, null, latency, now,
                List.of(), attempts, error);
    }

    public boolean hasVoice(String voiceId) {
        return voices.stream().anyMatch(v -> v.id().equals(voiceId));
    }
}
