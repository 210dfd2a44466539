package com.phillippitts.speechmaker.service.events;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.Severity;
import com.phillippitts.speechmaker.service.conversion.event.ConversionFailedEvent;
import com.phillippitts.speechmaker.service.error.ErrorRecordedEvent;
import com.phillippitts.speechmaker.service.metrics.ConversionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for classified errors. Counts every record and logs it, throttled per
 * category and code to avoid log spam during retry storms. Never logs text content.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final ConversionMetrics metrics;
    private final Clock clock;

    @Autowired
    ErrorEventsListener(ConversionMetrics metrics) {
        this(metrics, Clock.systemUTC());
    }

    ErrorEventsListener(ConversionMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onErrorRecorded(ErrorRecordedEvent e) {
        ErrorRecord record = e.record();
        metrics.incrementError(record.category());
        if (!shouldLog(record.category() + "-" + record.code())) {
            return;
        }
        if (record.severity() == Severity.CRITICAL) {
            LOG.error("{} during {}: {} (action={})", record.category(), record.operation(),
                    record.userMessage(), record.suggestedAction().wireName());
        } else if (record.severity() == Severity.INFO) {
            LOG.info("{} during {}", record.category(), record.operation());
        } else {
            LOG.warn("{} during {}: {} (retryable={}, action={})", record.category(), record.operation(),
                    record.userMessage(), record.canRetry(), record.suggestedAction().wireName());
        }
    }

    @EventListener
    void onConversionFailed(ConversionFailedEvent e) {
        if (shouldLog("session-" + e.error().category())) {
            LOG.warn("Conversion session {} ended: {}. Suggested action: {}", e.sessionId(),
                    e.error().userMessage(), e.error().suggestedAction().wireName());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
