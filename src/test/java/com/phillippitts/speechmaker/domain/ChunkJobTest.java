package com.phillippitts.speechmaker.domain;

import com.phillippitts.speechmaker.testutil.TestRecords;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkJobTest {

    @Test
    void retryCycleCountsAttempts() {
        ChunkJob job = new ChunkJob(1, "Hello.");

        job.start();
        job.fail(TestRecords.retryable(ErrorCategory.ENGINE_UNRESPONSIVE));
        assertThat(job.getStatus()).isEqualTo(ChunkStatus.FAILED);
        assertThat(job.getLastError()).isNotNull();

        job.requeue();
        job.start();
        job.succeed(Path.of("/tmp/chunk_1.wav"));

        assertThat(job.getStatus()).isEqualTo(ChunkStatus.SUCCEEDED);
        assertThat(job.getAttemptCount()).isEqualTo(2);
        assertThat(job.getOutputPath()).isEqualTo(Path.of("/tmp/chunk_1.wav"));
        assertThat(job.getLastError()).isNull();
    }

    @Test
    void illegalTransitionsThrow() {
        ChunkJob job = new ChunkJob(0, "x");

        assertThatThrownBy(() -> job.succeed(Path.of("a.wav"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(job::requeue).isInstanceOf(IllegalStateException.class);

        job.start();
        assertThatThrownBy(job::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IN_PROGRESS");
    }

    @Test
    void negativeIndexIsRejected() {
        assertThatThrownBy(() -> new ChunkJob(-1, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
