package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.domain.ChunkJob;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Best-effort removal of a session's chunk files and work directory.
 *
 * <p>Never throws: every failure is classified with operation {@code cleanup} and logged.
 */
public class ChunkFileCleaner {

    private static final Logger LOG = LogManager.getLogger(ChunkFileCleaner.class);

    private final ErrorClassifier classifier;

    public ChunkFileCleaner(ErrorClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Deletes each job's output file, then whatever is left in the work directory, then the
     * directory itself.
     *
     * @return number of files and directories removed
     */
    public int cleanup(List<ChunkJob> jobs, Path workDir) {
        int removed = 0;
        for (ChunkJob job : jobs) {
            Path output = job.getOutputPath();
            if (output != null && delete(output)) {
                removed++;
            }
        }
        if (workDir != null && Files.isDirectory(workDir)) {
            try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(workDir)) {
                for (Path leftover : leftovers) {
                    if (Files.isRegularFile(leftover) && delete(leftover)) {
                        removed++;
                    }
                }
            } catch (IOException e) {
                report(workDir, e);
            }
            if (delete(workDir)) {
                removed++;
            }
        }
        LOG.debug("Cleanup removed {} paths under {}", removed, workDir);
        return removed;
    }

    private boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException | SecurityException e) {
            report(path, e);
            return false;
        }
    }

    private void report(Path path, Exception e) {
        classifier.classify(e, ErrorContext.of(ErrorContext.CLEANUP).withFile(path));
        LOG.warn("Could not remove {}: {}", path, e.toString());
    }
}
