package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.domain.ChunkJob;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorLog;
import com.phillippitts.speechmaker.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkFileCleanerTest {

    @TempDir
    Path tempDir;

    private final ErrorLog errorLog = new ErrorLog(10);
    private final ChunkFileCleaner cleaner =
            new ChunkFileCleaner(new ErrorClassifier(errorLog, new EventCapturingPublisher()));

    @Test
    void removesChunkOutputsLeftoversAndWorkDir() throws IOException {
        // Arrange
        Path workDir = Files.createDirectories(tempDir.resolve("session-1"));
        ChunkJob done = new ChunkJob(0, "a");
        done.start();
        done.succeed(Files.writeString(workDir.resolve("chunk_0.wav"), "x"));
        ChunkJob pending = new ChunkJob(1, "b");
        Files.writeString(workDir.resolve("concat-123.txt"), "file 'x'");

        // Act
        int removed = cleaner.cleanup(List.of(done, pending), workDir);

        // Assert
        assertThat(removed).isEqualTo(3);
        assertThat(workDir).doesNotExist();
        assertThat(errorLog.size()).isZero();
    }

    @Test
    void missingWorkDirIsNotAnError() {
        int removed = cleaner.cleanup(List.of(new ChunkJob(0, "a")), tempDir.resolve("never-created"));

        assertThat(removed).isZero();
        assertThat(errorLog.size()).isZero();
    }

    @Test
    void undeletableDirectoryIsReportedNotThrown() throws IOException {
        Path workDir = Files.createDirectories(tempDir.resolve("session-2"));
        Files.createDirectories(workDir.resolve("nested"));
        Files.writeString(workDir.resolve("nested/keep.txt"), "x");

        int removed = cleaner.cleanup(List.of(), workDir);

        assertThat(removed).isZero();
        assertThat(workDir).exists();
        assertThat(errorLog.recent(1).get(0).operation()).isEqualTo("cleanup");
    }
}
