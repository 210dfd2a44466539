package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.config.properties.ConversionProperties;
import com.phillippitts.speechmaker.domain.ConversionSession;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.exception.ClassifiedException;
import com.phillippitts.speechmaker.exception.ConverterUnavailableException;
import com.phillippitts.speechmaker.exception.InvalidInputException;
import com.phillippitts.speechmaker.exception.NotReadyException;
import com.phillippitts.speechmaker.exception.SessionFailedException;
import com.phillippitts.speechmaker.exception.VoiceUnavailableException;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorContext;
import com.phillippitts.speechmaker.service.input.TextFileReader;
import com.phillippitts.speechmaker.service.output.OutputFileNamer;
import com.phillippitts.speechmaker.service.output.OutputFolders;
import com.phillippitts.speechmaker.service.readiness.ReadinessSnapshot;
import com.phillippitts.speechmaker.service.readiness.ReadinessStateMachine;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import com.phillippitts.speechmaker.service.text.TextChunker;
import com.phillippitts.speechmaker.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Application facade for conversions: validates requests, creates sessions, runs them on the
 * session executor and keeps them addressable by id.
 *
 * <p>Gates, in order: readiness ({@link NotReadyException}), speed range, non-empty text, voice in
 * the catalog, MP3 only with a converter. Rejections other than readiness are classified and thrown
 * as {@link ClassifiedException}.
 *
 * <p>Finished sessions stay addressable until more than {@code conversion.retained-sessions} of
 * them exist, then the oldest are discarded.
 */
public class ConversionService {

    private static final Logger LOG = LogManager.getLogger(ConversionService.class);

    static final double MIN_SPEED = 0.5;
    static final double MAX_SPEED = 2.0;

    private final ReadinessStateMachine readiness;
    private final ResourceResolver resolver;
    private final TextChunker chunker;
    private final TextFileReader fileReader;
    private final OutputFileNamer fileNamer;
    private final OutputFolders folders;
    private final ConversionOrchestrator orchestrator;
    private final ChunkFileCleaner cleaner;
    private final ErrorClassifier classifier;
    private final Executor sessionExecutor;
    private final ConversionProperties properties;
    private final Clock clock;

    private final Map<String, ConversionSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ConversionRequest> requests = new ConcurrentHashMap<>();

    public ConversionService(ReadinessStateMachine readiness,
                             ResourceResolver resolver,
                             TextChunker chunker,
                             TextFileReader fileReader,
                             OutputFileNamer fileNamer,
                             OutputFolders folders,
                             ConversionOrchestrator orchestrator,
                             ChunkFileCleaner cleaner,
                             ErrorClassifier classifier,
                             Executor sessionExecutor,
                             ConversionProperties properties,
                             Clock clock) {
        this.readiness = Objects.requireNonNull(readiness, "readiness");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader");
        this.fileNamer = Objects.requireNonNull(fileNamer, "fileNamer");
        this.folders = Objects.requireNonNull(folders, "folders");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validates the request and starts a session in the background.
     *
     * @return the PENDING or RUNNING session
     * @throws NotReadyException if the app is not ready
     * @throws ClassifiedException if the request is rejected
     * @throws IllegalArgumentException if speed is outside 0.5-2.0
     */
    public ConversionSession start(ConversionRequest request) {
        Objects.requireNonNull(request, "request");
        ReadinessSnapshot snapshot = readiness.snapshot();
        if (!snapshot.ready()) {
            throw new NotReadyException(snapshot.statusMessage());
        }

        double speed = request.speed() != null ? request.speed() : properties.getVoiceSpeed();
        if (Double.isNaN(speed) || speed < MIN_SPEED || speed > MAX_SPEED) {
            throw new IllegalArgumentException("Speed must be between " + MIN_SPEED + " and " + MAX_SPEED
                    + ", got " + speed);
        }

        String text = request.text();
        if (text == null || text.isBlank()) {
            throw reject(InvalidInputException.emptyText(), ErrorContext.of(ErrorContext.CONVERT));
        }

        String voiceId = request.voiceId();
        ResourceStatus catalog = resolver.resolve(ResourceKind.VOICE_CATALOG);
        if (voiceId == null || !catalog.hasVoice(voiceId)) {
            throw reject(voiceId == null || voiceId.isBlank()
                            ? VoiceUnavailableException.notFound("(none)")
                            : VoiceUnavailableException.notFound(voiceId),
                    ErrorContext.of(ErrorContext.CONVERT).withVoice(voiceId));
        }

        OutputFormat format = request.outputFormat() != null
                ? request.outputFormat() : properties.getDefaultOutputFormat();
        if (format == OutputFormat.MP3 && !snapshot.mp3Selectable()) {
            throw reject(new ConverterUnavailableException("convert to MP3"), ErrorContext.of(ErrorContext.CONVERT));
        }

        Path folder = request.outputFolder() != null ? request.outputFolder() : snapshot.outputFolder();
        if (folder == null) {
            throw new NotReadyException("Select an output folder");
        }
        Path output;
        try {
            output = fileNamer.next(folders.ensure(folder), format, clock.instant());
        } catch (RuntimeException e) {
            throw reject(e, ErrorContext.of(ErrorContext.CONVERT).withFile(folder));
        }

        List<String> chunks = chunker.split(text, properties.getMaxChunkLength());
        ConversionSession session = ConversionSession.create(chunks, voiceId, speed, format, output,
                folders.workRoot(), clock.instant());
        sessions.put(session.getId(), session);
        requests.put(session.getId(), new ConversionRequest(text, voiceId, speed, format, folder));

        LOG.info("Session {} created: text={}, chunks={}, output={}", session.getId(),
                LogSanitizer.preview(text), chunks.size(), output.getFileName());
        sessionExecutor.execute(() -> runSession(session));
        return session;
    }

    /**
     * Reads a text file and starts a session with its content.
     */
    public ConversionSession startFromFile(Path file, ConversionRequest request) {
        Objects.requireNonNull(file, "file");
        ReadinessSnapshot snapshot = readiness.snapshot();
        if (!snapshot.ready()) {
            throw new NotReadyException(snapshot.statusMessage());
        }
        String text;
        try {
            text = fileReader.read(file);
        } catch (IOException | RuntimeException e) {
            throw reject(e, ErrorContext.of(ErrorContext.READ_FILE).withFile(file));
        }
        return start(request.withText(text));
    }

    public Optional<ConversionSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** Sessions newest first. */
    public List<ConversionSession> list() {
        List<ConversionSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(ConversionSession::getCreatedAt).reversed());
        return all;
    }

    /**
     * Requests cancellation.
     *
     * @return true if the session existed and was not yet terminal
     */
    public boolean cancel(String sessionId) {
        ConversionSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        boolean signalled = session.requestCancel();
        if (signalled) {
            LOG.info("Cancellation requested for session {}", sessionId);
        }
        return signalled;
    }

    /**
     * Discards a failed or cancelled session's files and starts a new session with its parameters.
     *
     * @throws IllegalArgumentException if the session is unknown
     * @throws IllegalStateException if the session is not FAILED or CANCELLED
     */
    public ConversionSession retry(String sessionId) {
        ConversionSession previous = sessions.get(sessionId);
        if (previous == null) {
            throw new IllegalArgumentException("Unknown session: " + sessionId);
        }
        if (!previous.isTerminal() || previous.getResult() != null) {
            throw new IllegalStateException("Only failed or cancelled sessions can be retried, session "
                    + sessionId + " is " + previous.getStatus());
        }
        ConversionRequest request = requests.get(sessionId);
        if (request == null) {
            throw new IllegalArgumentException("Unknown session: " + sessionId);
        }
        ConversionSession next = start(request);
        discard(sessionId);
        LOG.info("Session {} retried as {}", sessionId, next.getId());
        return next;
    }

    /**
     * Removes a terminal session and any chunk files it retained.
     *
     * @return number of removed paths, or -1 if the session is unknown
     * @throws IllegalStateException if the session is still running
     */
    public int discard(String sessionId) {
        ConversionSession session = sessions.get(sessionId);
        if (session == null) {
            return -1;
        }
        if (!session.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is still " + session.getStatus());
        }
        int removed = cleaner.cleanup(session.getJobs(), session.getWorkDir());
        sessions.remove(sessionId);
        requests.remove(sessionId);
        return removed;
    }

    private void runSession(ConversionSession session) {
        try {
            orchestrator.convert(session);
            // only failed or cancelled sessions can be retried
            requests.remove(session.getId());
        } catch (SessionFailedException e) {
            LOG.info("Session {} ended {}: {}", session.getId(), session.getStatus(), e.getRecord().category());
        } catch (RuntimeException e) {
            LOG.error("Session {} failed unexpectedly", session.getId(), e);
            session.fail(classifier.classify(e, ErrorContext.of(ErrorContext.CONVERT)), clock.instant());
        } finally {
            evictFinishedSessions();
        }
    }

    /**
     * Discards the oldest finished sessions beyond {@code conversion.retained-sessions}, removing any
     * chunk files they retained. Running sessions are never evicted.
     */
    synchronized void evictFinishedSessions() {
        List<ConversionSession> finished = new ArrayList<>();
        for (ConversionSession s : sessions.values()) {
            if (s.isTerminal()) {
                finished.add(s);
            }
        }
        int excess = finished.size() - properties.getRetainedSessions();
        if (excess <= 0) {
            return;
        }
        finished.sort(Comparator.comparing(ConversionSession::getCreatedAt));
        for (ConversionSession s : finished.subList(0, excess)) {
            int removed = discard(s.getId());
            LOG.debug("Evicted session {} ({}), removed {} retained files", s.getId(), s.getStatus(), removed);
        }
    }

    /** Requests kept for retry; only failed or cancelled sessions hold one. */
    int retryableRequestCount() {
        return requests.size();
    }

    private ClassifiedException reject(Throwable cause, ErrorContext context) {
        ErrorRecord record = classifier.classify(cause, context);
        LOG.info("Conversion request rejected: category={}, code={}", record.category(), record.code());
        return new ClassifiedException(record, cause);
    }
}
