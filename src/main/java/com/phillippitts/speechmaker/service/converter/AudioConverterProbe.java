package com.phillippitts.speechmaker.service.converter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Locates and validates the audio converter executable. Used by the resource resolver.
 */
public interface AudioConverterProbe {

    /** Location of the converter shipped with the application, if one is configured for this platform. */
    Optional<Path> bundledCandidate();

    /** Filesystem-only check (exists, regular, executable). Never spawns a process. */
    boolean quickValidate(Path executable);

    /** Searches the system PATH. */
    Optional<Path> locateOnPath();

    /** Runs the executable's version query within the timeout. */
    boolean validate(Path executable, Duration timeout);
}
