package com.phillippitts.speechmaker.service.readiness;

import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.ResourceSource;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregates startup and resource state into one {@code ready} signal for the convert action.
 *
 * <p><b>Rule:</b> {@code ready = !initializing && voicesLoaded && (outputFolderSet || defaultOutputFolder != null)}.
 * The converter only decides whether MP3 is selectable; its absence never blocks {@code ready}.
 *
 * <p><b>Notifications:</b> every input update notifies its own topic; {@link ReadinessTopic#ACTION}
 * is notified when initialization changes or when {@code ready} or MP3 availability flips.
 * Listeners run after the lock is released, each in its own try/catch, in subscription order.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe. State is guarded by a
 * {@link ReentrantLock}; listener lists are copy-on-write.
 */
public class ReadinessStateMachine {

    private static final Logger LOG = LogManager.getLogger(ReadinessStateMachine.class);

    static final int TROUBLESHOOTING_ATTEMPTS = 3;

    private final Lock lock = new ReentrantLock();
    private final Map<ReadinessTopic, List<ReadinessListener>> listeners = new EnumMap<>(ReadinessTopic.class);

    private boolean initializing = true;
    private VoiceState voices = VoiceState.initial();
    private ResourceStatus converter;
    private boolean outputFolderSet;
    private Path selectedOutputFolder;
    private Path defaultOutputFolder;

    public ReadinessStateMachine() {
        for (ReadinessTopic topic : ReadinessTopic.values()) {
            listeners.put(topic, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * The readiness rule, for all combinations of its four inputs.
     */
    public static boolean computeReady(boolean initializing, boolean voicesLoaded,
                                       boolean outputFolderSet, Path defaultOutputFolder) {
        return !initializing && voicesLoaded && (outputFolderSet || defaultOutputFolder != null);
    }

    public void updateInitializing(boolean value) {
        ReadinessSnapshot snapshot;
        boolean changed;
        lock.lock();
        try {
            changed = initializing != value;
            initializing = value;
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }
        if (changed) {
            LOG.info("Initialization {}: {}", value ? "started" : "finished", snapshot.statusMessage());
            notifyListeners(ReadinessTopic.ACTION, snapshot);
        }
    }

    public void updateVoices(VoiceState state) {
        Objects.requireNonNull(state, "state");
        apply(ReadinessTopic.VOICE, () -> voices = state);
    }

    public void updateConverter(ResourceStatus status) {
        Objects.requireNonNull(status, "status");
        apply(ReadinessTopic.CONVERTER, () -> converter = status);
    }

    /**
     * @param set whether the user chose a folder
     * @param defaultFolder fallback folder, null if none could be determined
     */
    public void updateOutputFolder(boolean set, Path defaultFolder) {
        apply(ReadinessTopic.OUTPUT_FOLDER, () -> {
            outputFolderSet = set;
            defaultOutputFolder = defaultFolder;
            if (!set) {
                selectedOutputFolder = null;
            }
        });
    }

    /** User picked a folder; keeps the current default as fallback. */
    public void selectOutputFolder(Path folder) {
        Objects.requireNonNull(folder, "folder");
        apply(ReadinessTopic.OUTPUT_FOLDER, () -> {
            outputFolderSet = true;
            selectedOutputFolder = folder;
        });
    }

    /**
     * Downgrades MP3 to WAV when MP3 is not selectable.
     */
    public OutputFormat effectiveFormat(OutputFormat requested) {
        Objects.requireNonNull(requested, "requested");
        if (requested == OutputFormat.MP3 && !snapshot().mp3Selectable()) {
            return OutputFormat.WAV;
        }
        return requested;
    }

    public ReadinessSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady() {
        return snapshot().ready();
    }

    public Subscription subscribe(ReadinessTopic topic, ReadinessListener listener) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(listener, "listener");
        List<ReadinessListener> topicListeners = listeners.get(topic);
        topicListeners.add(listener);
        return () -> topicListeners.remove(listener);
    }

    private void apply(ReadinessTopic topic, Runnable mutation) {
        ReadinessSnapshot snapshot;
        boolean actionChanged;
        lock.lock();
        try {
            boolean readyBefore = readyLocked();
            boolean mp3Before = mp3SelectableLocked();
            mutation.run();
            actionChanged = readyBefore != readyLocked() || mp3Before != mp3SelectableLocked();
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }
        notifyListeners(topic, snapshot);
        if (actionChanged) {
            LOG.info("Convert action changed: ready={}, mp3={}", snapshot.ready(), snapshot.mp3Selectable());
            notifyListeners(ReadinessTopic.ACTION, snapshot);
        }
    }

    private void notifyListeners(ReadinessTopic topic, ReadinessSnapshot snapshot) {
        for (ReadinessListener listener : listeners.get(topic)) {
            try {
                listener.onChange(topic, snapshot);
            } catch (RuntimeException e) {
                LOG.error("Readiness listener failed on topic {}", topic, e);
            }
        }
    }

    private boolean readyLocked() {
        return computeReady(initializing, voices.loaded(), outputFolderSet, defaultOutputFolder);
    }

    private boolean mp3SelectableLocked() {
        return converter != null && converter.available();
    }

    private ReadinessSnapshot snapshotLocked() {
        boolean ready = readyLocked();
        boolean mp3 = mp3SelectableLocked();
        Path folder = selectedOutputFolder != null ? selectedOutputFolder : defaultOutputFolder;
        return new ReadinessSnapshot(
                ready,
                initializing,
                voices.loaded(),
                voices.loading(),
                voices.voices().size(),
                voices.attempts(),
                voices.attempts() > 0 && !voices.loaded(),
                voices.attempts() >= TROUBLESHOOTING_ATTEMPTS,
                voices.lastError(),
                converter == null ? ResourceSource.NONE : converter.source(),
                mp3,
                outputFolderSet,
                folder,
                statusMessage(ready, mp3));
    }

    private String statusMessage(boolean ready, boolean mp3) {
        if (initializing) {
            return "Initializing...";
        }
        if (voices.loading()) {
            return "Loading voices...";
        }
        if (!voices.loaded()) {
            return voices.lastError() != null
                    ? "No voices available: " + voices.lastError().userMessage()
                    : "No voices available";
        }
        if (!ready) {
            return "Select an output folder";
        }
        return mp3 ? "Ready" : "Ready (MP3 unavailable: FFmpeg not found)";
    }
}
