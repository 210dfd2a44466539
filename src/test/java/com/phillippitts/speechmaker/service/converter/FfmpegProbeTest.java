package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.speechmaker.service.process.ProcessTestDoubles.StubProcessFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegProbeTest {

    @TempDir
    Path tempDir;

    private final ConverterProperties props = new ConverterProperties();

    private FfmpegProbe probe(StubProcessFactory factory, Map<String, String> env, String os, String arch) {
        return new FfmpegProbe(new ProcessRunner(factory), props, env, os, arch);
    }

    private static Path executable(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "#!/bin/sh\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Test
    void platformAndArchAreNormalized() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        assertThat(probe(factory, Map.of(), "Windows 11", "amd64").platform()).isEqualTo("win32");
        assertThat(probe(factory, Map.of(), "Mac OS X", "aarch64").platform()).isEqualTo("darwin");
        assertThat(probe(factory, Map.of(), "Linux", "x86_64").platform()).isEqualTo("linux");
        assertThat(probe(factory, Map.of(), "Linux", "x86_64").arch()).isEqualTo("x64");
        assertThat(probe(factory, Map.of(), "Mac OS X", "arm64").arch()).isEqualTo("arm64");
    }

    @Test
    void bundledCandidateFollowsResourceLayout() {
        props.setResourcesDir(tempDir.toString());
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        Path linux = probe(factory, Map.of(), "Linux", "amd64").bundledCandidate().orElseThrow();
        Path windows = probe(factory, Map.of(), "Windows 10", "amd64").bundledCandidate().orElseThrow();

        assertThat(linux).isEqualTo(tempDir.resolve("ffmpeg/linux/x64/ffmpeg").toAbsolutePath());
        assertThat(windows.getFileName().toString()).isEqualTo("ffmpeg.exe");
    }

    @Test
    void configuredBundledPathWins() {
        props.setBundledPath(tempDir.resolve("custom/ffmpeg").toString());
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.ok(""));

        assertThat(probe(factory, Map.of(), "Linux", "amd64").bundledCandidate())
                .contains(tempDir.resolve("custom/ffmpeg").toAbsolutePath());
    }

    @Test
    void quickValidateRequiresExecutableRegularFile() throws IOException {
        FfmpegProbe probe = probe(StubProcessFactory.of(ProcessBehavior.ok("")), Map.of(), "Linux", "amd64");
        Path exe = executable(tempDir.resolve("bin/ffmpeg"));

        assertThat(probe.quickValidate(exe)).isTrue();
        assertThat(probe.quickValidate(tempDir.resolve("bin"))).isFalse();
        assertThat(probe.quickValidate(tempDir.resolve("missing"))).isFalse();
        assertThat(probe.quickValidate(null)).isFalse();
    }

    @Test
    void locateOnPathScansEntriesInOrder() throws IOException {
        // Arrange
        Path first = Files.createDirectories(tempDir.resolve("empty"));
        Path exe = executable(tempDir.resolve("tools/ffmpeg"));
        String path = first + File.pathSeparator + exe.getParent();
        FfmpegProbe probe = probe(StubProcessFactory.of(ProcessBehavior.ok("")), Map.of("PATH", path),
                "Linux", "amd64");

        // Act / Assert
        assertThat(probe.locateOnPath()).contains(exe);
    }

    @Test
    void locateOnPathReturnsEmptyWhenNotFound() {
        FfmpegProbe probe = probe(StubProcessFactory.of(ProcessBehavior.ok("")),
                Map.of("PATH", tempDir.toString()), "Linux", "amd64");

        assertThat(probe.locateOnPath()).isEmpty();
    }

    @Test
    void validateAcceptsVersionBanner() {
        StubProcessFactory factory = StubProcessFactory.of(
                ProcessBehavior.ok("ffmpeg version 6.1.1 Copyright (c) 2000-2023 the FFmpeg developers\n"));
        Path exe = tempDir.resolve("ffmpeg");

        assertThat(probe(factory, Map.of(), "Linux", "amd64").validate(exe, Duration.ofSeconds(3))).isTrue();
        assertThat(factory.lastCommand()).containsExactly(exe.toString(), "-version");
    }

    @Test
    void validateRejectsWrongOutputFailureAndStartError() {
        Path exe = tempDir.resolve("ffmpeg");

        assertThat(probe(StubProcessFactory.of(ProcessBehavior.ok("something else")), Map.of(), "Linux", "amd64")
                .validate(exe, Duration.ofSeconds(3))).isFalse();
        assertThat(probe(StubProcessFactory.of(ProcessBehavior.exit(1, "")), Map.of(), "Linux", "amd64")
                .validate(exe, Duration.ofSeconds(3))).isFalse();
        assertThat(probe(StubProcessFactory.failingWith(new IOException("No such file")), Map.of(),
                "Linux", "amd64").validate(exe, Duration.ofSeconds(3))).isFalse();
    }

    @Test
    void validateTimesOutOnHangingProcess() {
        StubProcessFactory factory = StubProcessFactory.of(ProcessBehavior.hang());

        assertThat(probe(factory, Map.of(), "Linux", "amd64")
                .validate(tempDir.resolve("ffmpeg"), Duration.ofMillis(100))).isFalse();
        assertThat(factory.lastProcess().wasDestroyCalled()).isTrue();
    }
}
