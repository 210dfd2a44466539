package com.phillippitts.speechmaker.service.metrics;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for conversions.
 *
 * <p>Tracks:
 * <ul>
 *   <li>Session outcomes and end-to-end duration</li>
 *   <li>Chunk outcomes and retries</li>
 *   <li>Classified errors per category</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "speechmaker.conversion";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished session.
     *
     * @param outcome succeeded, failed or cancelled
     * @param durationNanos wall time from start to terminal state
     */
    public void recordSession(String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".sessions")
                .description("Number of finished conversion sessions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("End-to-end conversion time")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementChunk(String outcome) {
        Counter.builder(METRIC_PREFIX + ".chunks")
                .description("Number of synthesized chunks by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRetry() {
        Counter.builder(METRIC_PREFIX + ".retries")
                .description("Number of chunk synthesis retries")
                .register(registry)
                .increment();
    }

    public void incrementError(ErrorCategory category) {
        Counter.builder("speechmaker.errors")
                .description("Number of classified errors by category")
                .tag("category", category.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
