package com.phillippitts.speechmaker.testutil;

import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.exception.ConverterUnavailableException;
import com.phillippitts.speechmaker.service.converter.AudioConverter;
import com.phillippitts.speechmaker.util.CancellationToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * In-memory {@link AudioConverter}: merge concatenates the input files byte-for-byte after the first
 * header, transcode copies the input. Either step can be scripted to fail.
 */
public class FakeAudioConverter implements AudioConverter {

    private final boolean available;
    private final List<List<Path>> merges = new ArrayList<>();
    private final List<Path> transcodes = new ArrayList<>();
    private Supplier<RuntimeException> mergeFailure;
    private Supplier<RuntimeException> transcodeFailure;

    public FakeAudioConverter(boolean available) {
        this.available = available;
    }

    public FakeAudioConverter failMerge(Supplier<RuntimeException> error) {
        this.mergeFailure = error;
        return this;
    }

    public FakeAudioConverter failTranscode(Supplier<RuntimeException> error) {
        this.transcodeFailure = error;
        return this;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public synchronized Path transcode(Path input, Path output, OutputFormat format, CancellationToken token) {
        if (!available) {
            throw new ConverterUnavailableException("convert audio to " + format.extension());
        }
        transcodes.add(input);
        if (transcodeFailure != null) {
            throw transcodeFailure.get();
        }
        try {
            Files.copy(input, output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    @Override
    public synchronized Path merge(List<Path> orderedInputs, Path output, CancellationToken token) {
        if (!available) {
            throw new ConverterUnavailableException("merge audio");
        }
        merges.add(List.copyOf(orderedInputs));
        if (mergeFailure != null) {
            throw mergeFailure.get();
        }
        try {
            byte[] first = Files.readAllBytes(orderedInputs.get(0));
            Files.write(output, first);
            for (Path input : orderedInputs.subList(1, orderedInputs.size())) {
                byte[] bytes = Files.readAllBytes(input);
                Files.write(output, Arrays.copyOfRange(bytes, 44, bytes.length),
                        StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    public synchronized List<List<Path>> merges() {
        return List.copyOf(merges);
    }

    public synchronized List<Path> transcodes() {
        return List.copyOf(transcodes);
    }
}
