package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import com.phillippitts.speechmaker.service.process.ProcessCommand;
import com.phillippitts.speechmaker.service.process.ProcessResult;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.util.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds ffmpeg: first the bundled copy at {@code <resourcesDir>/ffmpeg/<platform>/<arch>/ffmpeg[.exe]}
 * (or {@code converter.bundled-path}), then the system PATH. A candidate is valid when
 * {@code ffmpeg -version} exits 0 and reports an ffmpeg version.
 */
@Component
public class FfmpegProbe implements AudioConverterProbe {

    private static final Logger LOG = LogManager.getLogger(FfmpegProbe.class);

    static final String TOOL = "ffmpeg";

    private final ProcessRunner processRunner;
    private final ConverterProperties properties;
    private final Map<String, String> environment;
    private final String osName;
    private final String osArch;

    @Autowired
    public FfmpegProbe(ProcessRunner processRunner, ConverterProperties properties) {
        this(processRunner, properties, System.getenv(), System.getProperty("os.name", ""),
                System.getProperty("os.arch", ""));
    }

    FfmpegProbe(ProcessRunner processRunner, ConverterProperties properties, Map<String, String> environment,
                String osName, String osArch) {
        this.processRunner = processRunner;
        this.properties = properties;
        this.environment = environment;
        this.osName = osName.toLowerCase(Locale.ROOT);
        this.osArch = osArch.toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<Path> bundledCandidate() {
        String configured = properties.getBundledPath();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(Path.of(configured).toAbsolutePath());
        }
        return Optional.of(Path.of(properties.getResourcesDir(), "ffmpeg", platform(), arch(), executableName())
                .toAbsolutePath());
    }

    @Override
    public boolean quickValidate(Path executable) {
        return executable != null && Files.isRegularFile(executable) && Files.isExecutable(executable);
    }

    @Override
    public Optional<Path> locateOnPath() {
        String path = environment.getOrDefault("PATH", environment.getOrDefault("Path", ""));
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(dir.strip(), executableName());
                if (quickValidate(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (InvalidPathException e) {
                LOG.debug("Skipping invalid PATH entry '{}'", dir);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean validate(Path executable, Duration timeout) {
        ProcessCommand command = ProcessCommand.of(TOOL, List.of(executable.toString(), "-version"), timeout)
                .withErrorCodes(ErrorCodes.CONVERTER_MISSING, ErrorCodes.CONVERTER_TIMEOUT);
        try {
            ProcessResult result = processRunner.run(command, CancellationToken.none());
            boolean valid = result.isSuccess() && result.stdout().toLowerCase(Locale.ROOT).contains("ffmpeg version");
            if (!valid) {
                LOG.warn("ffmpeg at {} failed validation (exit={})", executable, result.exitCode());
            }
            return valid;
        } catch (SpeechMakerException e) {
            LOG.warn("ffmpeg at {} could not be validated: {}", executable, e.getMessage());
            return false;
        }
    }

    String platform() {
        if (osName.contains("win")) {
            return "win32";
        }
        if (osName.contains("mac") || osName.contains("darwin")) {
            return "darwin";
        }
        return "linux";
    }

    String arch() {
        return switch (osArch) {
            case "amd64", "x86_64" -> "x64";
            case "aarch64", "arm64" -> "arm64";
            default -> osArch;
        };
    }

    private String executableName() {
        String name = properties.getExecutableName();
        return platform().equals("win32") && !name.endsWith(".exe") ? name + ".exe" : name;
    }
}
