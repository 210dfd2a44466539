package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.ResourceSource;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.exception.ConverterUnavailableException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.ExternalProcessException;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import com.phillippitts.speechmaker.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FfmpegAudioConverterTest {

    @TempDir
    Path tempDir;

    private final ResourceResolver resolver = mock(ResourceResolver.class);
    private final ConverterProperties props = new ConverterProperties();
    private Path ffmpeg;

    @BeforeEach
    void setUp() {
        ffmpeg = tempDir.resolve("bin/ffmpeg");
        when(resolver.resolve(ResourceKind.AUDIO_CONVERTER)).thenReturn(
                ResourceStatus.converterFound(ResourceSource.SYSTEM, ffmpeg, Duration.ofMillis(5), Instant.now()));
    }

    private FfmpegAudioConverter converter(StubProcessFactory factory) {
        return new FfmpegAudioConverter(resolver, new ProcessRunner(factory), props);
    }

    @Test
    void transcodeUsesMp3CodecSettings() {
        // Arrange
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));
        Path in = tempDir.resolve("merged.wav");
        Path out = tempDir.resolve("speech.mp3");

        // Act
        Path result = converter(factory).transcode(in, out, OutputFormat.MP3, CancellationToken.none());

        // Assert
        assertThat(result).isEqualTo(out);
        List<String> cmd = factory.lastCommand();
        assertThat(cmd.get(0)).isEqualTo(ffmpeg.toString());
        assertThat(cmd).containsSubsequence("-y", "-i", in.toAbsolutePath().toString());
        assertThat(cmd).containsSubsequence("-acodec", "libmp3lame", "-ab", "128k", "-ar", "44100");
        assertThat(cmd.get(cmd.size() - 1)).isEqualTo(out.toAbsolutePath().toString());
    }

    @Test
    void transcodeFailureCarriesTranscodeCode() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.exit(1, "Invalid data found"));

        assertThatThrownBy(() -> converter(factory).transcode(tempDir.resolve("a.wav"), tempDir.resolve("a.mp3"),
                OutputFormat.MP3, CancellationToken.none()))
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("MP3 conversion failed")
                .satisfies(e -> assertThat(((ExternalProcessException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.TRANSCODE_FAILED));
    }

    @Test
    void mergeWritesConcatListAndDeletesIt() throws IOException {
        // Arrange
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));
        List<Path> inputs = List.of(tempDir.resolve("chunk_0.wav"), tempDir.resolve("chunk_1.wav"));
        Path out = tempDir.resolve("merged.wav");

        // Act
        converter(factory).merge(inputs, out, CancellationToken.none());

        // Assert
        List<String> cmd = factory.lastCommand();
        assertThat(cmd).containsSubsequence("-f", "concat", "-safe", "0", "-i");
        assertThat(cmd).containsSubsequence("-acodec", "pcm_s16le");
        try (Stream<Path> left = Files.list(tempDir)) {
            assertThat(left.map(p -> p.getFileName().toString())).noneMatch(n -> n.startsWith("concat-"));
        }
    }

    @Test
    void mergeFailureStillDeletesConcatList() throws IOException {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.exit(1, "bad input"));
        Path out = tempDir.resolve("merged.wav");

        assertThatThrownBy(() -> converter(factory).merge(List.of(tempDir.resolve("chunk_0.wav")), out,
                CancellationToken.none()))
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("Audio merging failed");

        try (Stream<Path> left = Files.list(tempDir)) {
            assertThat(left.map(p -> p.getFileName().toString())).noneMatch(n -> n.startsWith("concat-"));
        }
    }

    @Test
    void concatListEscapesSingleQuotes() {
        Path tricky = tempDir.resolve("it's.wav");

        String list = FfmpegAudioConverter.concatList(List.of(tricky, tempDir.resolve("b.wav")));

        assertThat(list).startsWith("file '" + tempDir.toAbsolutePath() + "/it'\\''s.wav'\n");
        assertThat(list.lines()).hasSize(2);
    }

    @Test
    void missingConverterFailsWithoutStartingProcess() {
        when(resolver.resolve(ResourceKind.AUDIO_CONVERTER)).thenReturn(
                ResourceStatus.converterMissing(Duration.ZERO, Instant.now(), null));
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));
        FfmpegAudioConverter converter = converter(factory);

        assertThat(converter.isAvailable()).isFalse();
        assertThatThrownBy(() -> converter.transcode(tempDir.resolve("a.wav"), tempDir.resolve("a.mp3"),
                OutputFormat.MP3, CancellationToken.none()))
                .isInstanceOf(ConverterUnavailableException.class)
                .hasMessageContaining("FFmpeg is not installed");
        assertThat(factory.commands()).isEmpty();
    }

    @Test
    void emptyMergeIsRejected() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        assertThatThrownBy(() -> converter(factory).merge(List.of(), tempDir.resolve("x.wav"),
                CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
