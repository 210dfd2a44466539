package com.phillippitts.speechmaker.domain;

import com.phillippitts.speechmaker.testutil.TestRecords;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionSessionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static ConversionSession session() {
        return ConversionSession.create(List.of("One.", "Two.", "Three."), "en-US-AriaNeural", 1.0,
                OutputFormat.WAV, Path.of("/out/speech.wav"), Path.of("/tmp/speechmaker"), NOW);
    }

    @Test
    void createBuildsIndexedPendingJobsAndPrivateWorkDir() {
        ConversionSession session = session();

        assertThat(session.getStatus()).isEqualTo(SessionStatus.PENDING);
        assertThat(session.getJobs()).extracting(ChunkJob::getIndex).containsExactly(0, 1, 2);
        assertThat(session.getJobs()).extracting(ChunkJob::getStatus).containsOnly(ChunkStatus.PENDING);
        assertThat(session.getWorkDir()).isEqualTo(Path.of("/tmp/speechmaker", "session-" + session.getId()));
    }

    @Test
    void terminalTransitionHappensOnce() {
        ConversionSession session = session();

        assertThat(session.markRunning()).isTrue();
        assertThat(session.markRunning()).isFalse();
        assertThat(session.complete(Path.of("/out/speech.wav"), NOW)).isTrue();
        assertThat(session.fail(TestRecords.terminal(ErrorCategory.UNKNOWN), NOW)).isFalse();

        assertThat(session.getStatus()).isEqualTo(SessionStatus.SUCCEEDED);
        assertThat(session.getResult()).isEqualTo(Path.of("/out/speech.wav"));
        assertThat(session.getError()).isNull();
        assertThat(session.getFinishedAt()).isEqualTo(NOW);
    }

    @Test
    void requestCancelSignalsTokenOnlyWhileActive() {
        ConversionSession active = session();
        assertThat(active.requestCancel()).isTrue();
        assertThat(active.getCancellationToken().isCancelled()).isTrue();
        assertThat(active.requestCancel()).isFalse();

        ConversionSession finished = session();
        finished.fail(TestRecords.terminal(ErrorCategory.UNKNOWN), NOW);
        assertThat(finished.requestCancel()).isFalse();
        assertThat(finished.getCancellationToken().isCancelled()).isFalse();
    }

    @Test
    void jobsMustBeOrderedByIndex() {
        List<ChunkJob> jobs = List.of(new ChunkJob(1, "b"), new ChunkJob(0, "a"));

        assertThatThrownBy(() -> new ConversionSession("id", jobs, "v", 1.0, OutputFormat.WAV,
                Path.of("o.wav"), Path.of("w"), NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ordered by index");
    }

    @Test
    void completedChunksCountsSucceededJobs() {
        ConversionSession session = session();
        ChunkJob first = session.getJobs().get(0);
        first.start();
        first.succeed(Path.of("/tmp/chunk_0.wav"));

        assertThat(session.completedChunks()).isEqualTo(1);
        assertThat(session.isTerminal()).isFalse();
    }
}
