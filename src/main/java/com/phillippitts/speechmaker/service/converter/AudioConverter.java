package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.util.CancellationToken;

import java.nio.file.Path;
import java.util.List;

/**
 * External audio converter (ffmpeg). May be entirely absent; callers check {@link #isAvailable()}
 * or handle {@link com.phillippitts.speechmaker.exception.ConverterUnavailableException}.
 */
public interface AudioConverter {

    boolean isAvailable();

    /**
     * Re-encodes {@code input} into {@code output} in the given format.
     */
    Path transcode(Path input, Path output, OutputFormat format, CancellationToken token);

    /**
     * Concatenates the inputs, in list order, into {@code output}.
     */
    Path merge(List<Path> orderedInputs, Path output, CancellationToken token);
}
