package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.config.properties.VoiceEngineProperties;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.ExternalProcessException;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.speechmaker.util.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeTtsVoiceEngineTest {

    @TempDir
    Path tempDir;

    private final VoiceEngineProperties props = new VoiceEngineProperties();

    private EdgeTtsVoiceEngine engine(StubProcessFactory factory) {
        return new EdgeTtsVoiceEngine(new ProcessRunner(factory), props);
    }

    @Test
    void listVoicesRunsListCommandAndParsesOutput() {
        // Arrange
        StubProcessFactory factory = StubProcessFactory.of(
                ProcessBehavior.ok("Name: en-US-AriaNeural\nGender: Female\n"));

        // Act
        List<Voice> voices = engine(factory).listVoices(Duration.ofSeconds(5));

        // Assert
        assertThat(factory.lastCommand()).containsExactly("edge-tts", "--list-voices");
        assertThat(voices).extracting(Voice::id).containsExactly("en-US-AriaNeural");
    }

    @Test
    void listVoicesFailureIsEngineStartFailure() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.exit(1, "edge-tts: command crashed"));

        assertThatThrownBy(() -> engine(factory).listVoices(Duration.ofSeconds(5)))
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("Failed to execute edge-tts")
                .satisfies(e -> assertThat(((ExternalProcessException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.ENGINE_START_FAILED));
    }

    @Test
    void synthesizePassesOptionsInEqualsForm() throws IOException {
        // Arrange
        Path output = tempDir.resolve("chunk_0.wav");
        Files.write(output, new byte[]{1, 2, 3});
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        // Act
        Path written = engine(factory).synthesize("-leading dash", "en-US-AriaNeural", 0.75, output,
                CancellationToken.none());

        // Assert
        assertThat(written).isEqualTo(output);
        assertThat(factory.lastCommand()).containsExactly(
                "edge-tts",
                "--voice=en-US-AriaNeural",
                "--rate=-25%",
                "--text=-leading dash",
                "--write-media", output.toAbsolutePath().toString());
    }

    @Test
    void rateParameterIsSignedPercentage() {
        assertThat(EdgeTtsVoiceEngine.rateParameter(1.0)).isEqualTo("+0%");
        assertThat(EdgeTtsVoiceEngine.rateParameter(1.5)).isEqualTo("+50%");
        assertThat(EdgeTtsVoiceEngine.rateParameter(2.0)).isEqualTo("+100%");
        assertThat(EdgeTtsVoiceEngine.rateParameter(0.5)).isEqualTo("-50%");
        assertThat(EdgeTtsVoiceEngine.rateParameter(1.234)).isEqualTo("+23%");
    }

    @Test
    void chunkFilesAreMp3() {
        assertThat(engine(new StubProcessFactory()).audioFormat()).isEqualTo(OutputFormat.MP3);
    }

    @Test
    void speedOutsideRangeIsRejectedBeforeStartingProcess() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));
        EdgeTtsVoiceEngine engine = engine(factory);
        Path output = tempDir.resolve("out.wav");

        assertThatThrownBy(() -> engine.synthesize("hi", "v", 2.5, output, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.synthesize("hi", "v", 0.4, output, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(factory.commands()).isEmpty();
    }

    @Test
    void nonZeroExitIsSynthesisFailure() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.exit(2, "connection reset"));

        assertThatThrownBy(() -> engine(factory).synthesize("hi", "v", 1.0, tempDir.resolve("a.wav"),
                CancellationToken.none()))
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("TTS conversion failed")
                .satisfies(e -> assertThat(((ExternalProcessException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.SYNTHESIS_FAILED));
    }

    @Test
    void missingOutputFileIsSynthesisFailure() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        assertThatThrownBy(() -> engine(factory).synthesize("hi", "v", 1.0, tempDir.resolve("never.wav"),
                CancellationToken.none()))
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("produced no audio");
    }

    @Test
    void processSlotIsReleasedAfterFailure() {
        props.setMaxConcurrentProcesses(1);
        props.setAcquireTimeoutMs(100);
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.exit(1, "boom"));
        EdgeTtsVoiceEngine engine = engine(factory);

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> engine.synthesize("hi", "v", 1.0, tempDir.resolve("x.wav"),
                    CancellationToken.none()))
                    .hasMessageContaining("TTS conversion failed");
        }
        assertThat(factory.commands()).hasSize(3);
    }
}
