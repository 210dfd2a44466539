package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.config.properties.VoiceEngineProperties;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.ExternalProcessExceptionBuilder;
import com.phillippitts.speechmaker.service.process.ProcessCommand;
import com.phillippitts.speechmaker.service.process.ProcessResult;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.util.CancellationToken;
import com.phillippitts.speechmaker.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link VoiceEngine} backed by the edge-tts command line tool.
 *
 * <p>CLI contract:
 * <pre>
 *   edge-tts --list-voices
 *   edge-tts --voice=${voiceId} --rate=${+N%|-N%} --text=${text} --write-media ${output}
 * </pre>
 * where {@code N = round((speed - 1) * 100)}. The {@code --opt=value} form keeps values that start
 * with a dash (negative rates, text) from being read as options. edge-tts always writes MPEG audio,
 * whatever the output file is called.
 */
@Component
public class EdgeTtsVoiceEngine implements VoiceEngine {

    private static final Logger LOG = LogManager.getLogger(EdgeTtsVoiceEngine.class);

    static final String TOOL = "edge-tts";
    static final double MIN_SPEED = 0.5;
    static final double MAX_SPEED = 2.0;

    private final ProcessRunner processRunner;
    private final VoiceEngineProperties properties;
    private final ConcurrencyGuard guard;

    public EdgeTtsVoiceEngine(ProcessRunner processRunner, VoiceEngineProperties properties) {
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.guard = new ConcurrencyGuard(properties.getMaxConcurrentProcesses(),
                properties.getAcquireTimeoutMs(), TOOL);
    }

    @Override
    public List<Voice> listVoices(Duration timeout) {
        ProcessCommand command = ProcessCommand.of(TOOL, List.of(properties.getBinary(), "--list-voices"), timeout)
                .withMaxStdoutBytes(properties.getMaxStdoutBytes());
        ProcessResult result = processRunner.run(command, CancellationToken.none());
        if (!result.isSuccess()) {
            throw ProcessRunner.failure("Failed to execute edge-tts --list-voices", command, result,
                    ErrorCodes.ENGINE_START_FAILED);
        }
        List<Voice> voices = VoiceListParser.parse(result.stdout());
        LOG.info("Voice engine listed {} voices in {} ms", voices.size(), result.durationMs());
        return voices;
    }

    @Override
    public OutputFormat audioFormat() {
        return OutputFormat.MP3;
    }

    @Override
    public Path synthesize(String text, String voiceId, double speed, Path output, CancellationToken token) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voiceId, "voiceId");
        Objects.requireNonNull(output, "output");
        if (speed < MIN_SPEED || speed > MAX_SPEED) {
            throw new IllegalArgumentException("speed must be within [" + MIN_SPEED + ", " + MAX_SPEED
                    + "], got " + speed);
        }

        ProcessCommand command = ProcessCommand.of(TOOL, List.of(
                        properties.getBinary(),
                        "--voice=" + voiceId,
                        "--rate=" + rateParameter(speed),
                        "--text=" + text,
                        "--write-media", output.toAbsolutePath().toString()),
                Duration.ofSeconds(properties.getSynthesisTimeoutSeconds()))
                .withWorkingDir(output.toAbsolutePath().getParent());

        LOG.debug("Synthesizing {} with voice={}, speed={}", LogSanitizer.preview(text), voiceId, speed);
        guard.acquire();
        try {
            ProcessResult result = processRunner.run(command, token);
            if (!result.isSuccess()) {
                throw ProcessRunner.failure("TTS conversion failed", command, result, ErrorCodes.SYNTHESIS_FAILED);
            }
            if (isMissingOrEmpty(output)) {
                throw ExternalProcessExceptionBuilder.create("TTS conversion failed: engine produced no audio")
                        .tool(TOOL)
                        .code(ErrorCodes.SYNTHESIS_FAILED)
                        .durationMs(result.durationMs())
                        .metadata("output", output.getFileName())
                        .build();
            }
            return output;
        } finally {
            guard.release();
        }
    }

    /** {@code +0%}, {@code +50%}, {@code -25%}. */
    static String rateParameter(double speed) {
        long percent = Math.round((speed - 1.0) * 100);
        return (percent >= 0 ? "+" : "") + percent + "%";
    }

    private static boolean isMissingOrEmpty(Path output) {
        try {
            return !Files.isRegularFile(output) || Files.size(output) == 0;
        } catch (IOException e) {
            return true;
        }
    }
}
