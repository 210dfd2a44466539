package com.phillippitts.speechmaker.service.output;

import com.phillippitts.speechmaker.domain.OutputFormat;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names output files {@code speech_<timestamp>.<ext>}, unique within the target folder.
 */
@Component
public class OutputFileNamer {

    static final String PREFIX = "speech_";
    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");
    private static final int MAX_SUFFIX = 10_000;

    /**
     * @return a path in {@code folder} that does not exist yet
     */
    public Path next(Path folder, OutputFormat format, Instant now) {
        Objects.requireNonNull(folder, "folder");
        Objects.requireNonNull(format, "format");
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(now).replace(':', '-').replace('.', '-');
        return unique(folder, sanitize(PREFIX + timestamp), format.extension());
    }

    /** Replaces characters that are invalid in file names on any supported OS. */
    public static String sanitize(String name) {
        return UNSAFE.matcher(name).replaceAll("_");
    }

    static Path unique(Path folder, String baseName, String extension) {
        Path candidate = folder.resolve(baseName + "." + extension);
        for (int i = 1; Files.exists(candidate); i++) {
            if (i > MAX_SUFFIX) {
                throw new IllegalStateException("No free file name for " + baseName + " in " + folder);
            }
            candidate = folder.resolve(baseName + "_" + i + "." + extension);
        }
        return candidate;
    }
}
