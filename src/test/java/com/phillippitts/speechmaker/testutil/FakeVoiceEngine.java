package com.phillippitts.speechmaker.testutil;

import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.service.engine.VoiceEngine;
import com.phillippitts.speechmaker.util.CancellationToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable {@link VoiceEngine}. By default synthesis writes a small PCM WAV whose samples all equal
 * {@code chunkIndex + 1} (parsed from the {@code chunk_<i>.wav} target name), so merged output
 * order can be asserted. {@link #emittingMp3(int)} switches to silent MPEG frames, as edge-tts writes.
 */
public class FakeVoiceEngine implements VoiceEngine {

    private final List<Voice> voices = new CopyOnWriteArrayList<>();
    private final Deque<Supplier<RuntimeException>> listFailures = new ArrayDeque<>();
    private final Map<String, Deque<Supplier<RuntimeException>>> synthFailures = new ConcurrentHashMap<>();
    private final Map<String, Long> synthDelays = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> blockers = new ConcurrentHashMap<>();
    private final List<String> completionOrder = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger listCalls = new AtomicInteger();
    private final AtomicInteger synthCalls = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private volatile int mp3Frames;

    public FakeVoiceEngine withVoices(Voice... list) {
        voices.addAll(List.of(list));
        return this;
    }

    /** Next {@code times} listing calls throw the supplied exception. */
    public synchronized FakeVoiceEngine failListing(int times, Supplier<RuntimeException> error) {
        for (int i = 0; i < times; i++) {
            listFailures.add(error);
        }
        return this;
    }

    /** Next {@code times} synthesis calls for this text throw the supplied exception. */
    public FakeVoiceEngine failSynthesis(String text, int times, Supplier<RuntimeException> error) {
        Deque<Supplier<RuntimeException>> queue = synthFailures.computeIfAbsent(text, t -> new ArrayDeque<>());
        synchronized (queue) {
            for (int i = 0; i < times; i++) {
                queue.add(error);
            }
        }
        return this;
    }

    /** Synthesis writes an ID3-tagged MPEG file of {@code frames} silent frames. */
    public FakeVoiceEngine emittingMp3(int frames) {
        this.mp3Frames = frames;
        return this;
    }

    @Override
    public OutputFormat audioFormat() {
        return mp3Frames > 0 ? OutputFormat.MP3 : OutputFormat.WAV;
    }

    public FakeVoiceEngine delay(String text, long millis) {
        synthDelays.put(text, millis);
        return this;
    }

    /** Synthesis of this text blocks until the returned latch is released or the token is cancelled. */
    public CountDownLatch block(String text) {
        CountDownLatch latch = new CountDownLatch(1);
        blockers.put(text, latch);
        return latch;
    }

    @Override
    public List<Voice> listVoices(Duration timeout) {
        listCalls.incrementAndGet();
        Supplier<RuntimeException> failure;
        synchronized (this) {
            failure = listFailures.poll();
        }
        if (failure != null) {
            throw failure.get();
        }
        return List.copyOf(voices);
    }

    @Override
    public Path synthesize(String text, String voiceId, double speed, Path output, CancellationToken token) {
        synthCalls.incrementAndGet();
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            token.throwIfCancelled("synthesize");
            Deque<Supplier<RuntimeException>> queue = synthFailures.get(text);
            Supplier<RuntimeException> failure = null;
            if (queue != null) {
                synchronized (queue) {
                    failure = queue.poll();
                }
            }
            if (failure != null) {
                throw failure.get();
            }
            pause(text, token);
            if (mp3Frames > 0) {
                Mp3Files.write(output, mp3Frames, true);
            } else {
                WavFiles.write(output, markerFor(output), 8);
            }
            completionOrder.add(text);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            running.decrementAndGet();
        }
    }

    private void pause(String text, CancellationToken token) {
        CountDownLatch blocker = blockers.get(text);
        Long delayMs = synthDelays.get(text);
        try {
            if (blocker != null) {
                CountDownLatch cancelled = new CountDownLatch(1);
                try (CancellationToken.Registration ignored = token.onCancel(cancelled::countDown)) {
                    while (blocker.getCount() > 0 && cancelled.getCount() > 0) {
                        blocker.await(10, TimeUnit.MILLISECONDS);
                    }
                }
            }
            if (delayMs != null) {
                Thread.sleep(delayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        token.throwIfCancelled("synthesize");
        if (Thread.currentThread().isInterrupted()) {
            throw new ConversionCancelledException("synthesize");
        }
    }

    static short markerFor(Path output) {
        String name = output.getFileName().toString();
        if (name.startsWith("chunk_") && name.endsWith(".wav")) {
            return (short) (Integer.parseInt(name.substring(6, name.length() - 4)) + 1);
        }
        return 1;
    }

    public int listCalls() {
        return listCalls.get();
    }

    public int synthCalls() {
        return synthCalls.get();
    }

    public int maxConcurrentSyntheses() {
        return maxRunning.get();
    }

    /** Texts in the order their synthesis finished. */
    public List<String> completionOrder() {
        synchronized (completionOrder) {
            return List.copyOf(completionOrder);
        }
    }
}
