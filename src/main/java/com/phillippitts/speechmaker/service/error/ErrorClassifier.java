package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.exception.ClassifiedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw failures to normalized {@link ErrorRecord}s using the {@link ErrorRules} table.
 *
 * <p>Classification is deterministic for a given raw signature (code, message) and operation: only
 * the record id and timestamp differ between two classifications of the same failure. Every record
 * is appended to the {@link ErrorLog} and published as an {@link ErrorRecordedEvent}.
 *
 * <p>The classifier never terminates the process. {@code CRITICAL} records are surfaced to the host
 * through health reporting.
 */
public class ErrorClassifier {

    private static final Logger LOG = LogManager.getLogger(ErrorClassifier.class);

    private static final Pattern SIZE_MB = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*MB");
    private static final Pattern QUOTED_VOICE = Pattern.compile("[Vv]oice\\s+'([^']+)'");
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_RANDOM_CHARS = 9;

    private final ErrorLog errorLog;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ErrorClassifier(ErrorLog errorLog, ApplicationEventPublisher publisher) {
        this(errorLog, publisher, Clock.systemUTC());
    }

    public ErrorClassifier(ErrorLog errorLog, ApplicationEventPublisher publisher, Clock clock) {
        this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Classifies an exception. An already classified exception returns its record unchanged and is
     * not logged again.
     */
    public ErrorRecord classify(Throwable error, ErrorContext context) {
        Objects.requireNonNull(error, "error");
        if (error instanceof ClassifiedException classified) {
            return classified.getRecord();
        }
        return classify(RawFailure.from(error), context);
    }

    public ErrorRecord classify(RawFailure failure, ErrorContext context) {
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(context, "context");

        ErrorRule rule = ErrorRules.lookup(failure, context.operation());
        long now = clock.millis();
        ErrorRecord record = new ErrorRecord(
                newId(now),
                Instant.ofEpochMilli(now),
                rule.category(),
                rule.severity(),
                renderMessage(rule.userMessage(), failure, context),
                rule.troubleshooting(),
                rule.canRetry(),
                rule.action(),
                failure.code(),
                failure.message(),
                context.operation());

        errorLog.append(record);
        LOG.debug("Classified failure: id={}, operation={}, code={}, category={}, canRetry={}",
                record.id(), record.operation(), record.code(), record.category(), record.canRetry());
        publisher.publishEvent(new ErrorRecordedEvent(record));
        return record;
    }

    /** Classifies and wraps, for callers that must abort with the record attached. */
    public ClassifiedException toException(Throwable error, ErrorContext context) {
        if (error instanceof ClassifiedException classified) {
            return classified;
        }
        return new ClassifiedException(classify(error, context), error);
    }

    public ErrorLog getErrorLog() {
        return errorLog;
    }

    private static String renderMessage(String template, RawFailure failure, ErrorContext context) {
        String out = template;
        if (out.contains("{file}")) {
            out = out.replace("{file}", fileName(context.filePath()));
        }
        if (out.contains("{voice}")) {
            out = out.replace("{voice}", voiceName(failure, context));
        }
        if (out.contains("{size}")) {
            Matcher m = SIZE_MB.matcher(failure.message());
            out = out.replace("{size}", m.find() ? m.group(1) : "unknown");
        }
        return out;
    }

    private static String fileName(Path path) {
        if (path == null || path.getFileName() == null) {
            return "the file";
        }
        return path.getFileName().toString();
    }

    private static String voiceName(RawFailure failure, ErrorContext context) {
        if (context.voiceId() != null) {
            return context.voiceId();
        }
        Matcher m = QUOTED_VOICE.matcher(failure.message());
        return m.find() ? m.group(1) : "unknown";
    }

    static String newId(long epochMillis) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("err_").append(epochMillis).append('_');
        for (int i = 0; i < ID_RANDOM_CHARS; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
