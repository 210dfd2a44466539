package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.exception.ConverterUnavailableException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import com.phillippitts.speechmaker.service.process.ProcessCommand;
import com.phillippitts.speechmaker.service.process.ProcessResult;
import com.phillippitts.speechmaker.service.process.ProcessRunner;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import com.phillippitts.speechmaker.util.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link AudioConverter} backed by ffmpeg, located through the {@link ResourceResolver}.
 *
 * <p>CLI contracts:
 * <pre>
 *   transcode: ffmpeg -y -i in.wav -acodec libmp3lame -ab 128k -ar 44100 out.mp3
 *   merge:     ffmpeg -y -f concat -safe 0 -i list.txt -acodec pcm_s16le out.wav
 * </pre>
 * The merge list file is written next to the output and always deleted afterwards.
 */
@Component
public class FfmpegAudioConverter implements AudioConverter {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioConverter.class);

    static final String TOOL = "ffmpeg";

    private final ResourceResolver resourceResolver;
    private final ProcessRunner processRunner;
    private final ConverterProperties properties;

    public FfmpegAudioConverter(ResourceResolver resourceResolver, ProcessRunner processRunner,
                                ConverterProperties properties) {
        this.resourceResolver = Objects.requireNonNull(resourceResolver, "resourceResolver");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public boolean isAvailable() {
        return resourceResolver.resolve(ResourceKind.AUDIO_CONVERTER).available();
    }

    @Override
    public Path transcode(Path input, Path output, OutputFormat format, CancellationToken token) {
        Path binary = binary("convert audio to " + format.extension());
        List<String> cmd = new ArrayList<>(List.of(binary.toString(), "-y", "-hide_banner", "-loglevel", "error",
                "-i", input.toAbsolutePath().toString()));
        cmd.addAll(codecArguments(format));
        cmd.add(output.toAbsolutePath().toString());

        ProcessCommand command = ProcessCommand.of(TOOL, cmd, timeout())
                .withErrorCodes(ErrorCodes.CONVERTER_MISSING, ErrorCodes.TRANSCODE_FAILED);
        ProcessResult result = processRunner.run(command, token);
        if (!result.isSuccess()) {
            throw ProcessRunner.failure("MP3 conversion failed", command, result, ErrorCodes.TRANSCODE_FAILED);
        }
        LOG.info("Transcoded {} to {} in {} ms", input.getFileName(), output.getFileName(), result.durationMs());
        return output;
    }

    @Override
    public Path merge(List<Path> orderedInputs, Path output, CancellationToken token) {
        if (orderedInputs.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        Path binary = binary("merge audio");
        Path listFile = writeConcatList(orderedInputs, output);
        try {
            List<String> cmd = new ArrayList<>(List.of(binary.toString(), "-y", "-hide_banner", "-loglevel", "error",
                    "-f", "concat", "-safe", "0", "-i", listFile.toString()));
            cmd.addAll(codecArguments(formatOf(output)));
            cmd.add(output.toAbsolutePath().toString());

            ProcessCommand command = ProcessCommand.of(TOOL, cmd, timeout())
                    .withErrorCodes(ErrorCodes.CONVERTER_MISSING, ErrorCodes.MERGE_FAILED);
            ProcessResult result = processRunner.run(command, token);
            if (!result.isSuccess()) {
                throw ProcessRunner.failure("Audio merging failed", command, result, ErrorCodes.MERGE_FAILED);
            }
            LOG.info("Merged {} chunks into {} in {} ms", orderedInputs.size(), output.getFileName(),
                    result.durationMs());
            return output;
        } finally {
            try {
                Files.deleteIfExists(listFile);
            } catch (IOException e) {
                LOG.warn("Could not delete concat list {}: {}", listFile, e.toString());
            }
        }
    }

    private Path binary(String operation) {
        ResourceStatus status = resourceResolver.resolve(ResourceKind.AUDIO_CONVERTER);
        if (!status.available() || status.location() == null) {
            throw new ConverterUnavailableException(operation);
        }
        return status.location();
    }

    private List<String> codecArguments(OutputFormat format) {
        if (format == OutputFormat.MP3) {
            return List.of("-acodec", "libmp3lame", "-ab", properties.getMp3Bitrate(),
                    "-ar", String.valueOf(properties.getSampleRate()));
        }
        return List.of("-acodec", "pcm_s16le");
    }

    private static OutputFormat formatOf(Path output) {
        return output.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".mp3") ? OutputFormat.MP3 : OutputFormat.WAV;
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getConversionTimeoutSeconds());
    }

    /** ffmpeg concat demuxer list: one {@code file '<path>'} line per input, single quotes escaped. */
    static String concatList(List<Path> inputs) {
        StringBuilder sb = new StringBuilder();
        for (Path input : inputs) {
            String escaped = input.toAbsolutePath().toString().replace("'", "'\\''");
            sb.append("file '").append(escaped).append("'\n");
        }
        return sb.toString();
    }

    private static Path writeConcatList(List<Path> inputs, Path output) {
        try {
            Path dir = output.toAbsolutePath().getParent();
            Path listFile = Files.createTempFile(dir, "concat-", ".txt");
            Files.writeString(listFile, concatList(inputs), StandardCharsets.UTF_8);
            return listFile;
        } catch (IOException e) {
            throw new SpeechMakerException("Audio merging failed: cannot write concat list", ErrorCodes.MERGE_FAILED, e);
        }
    }
}
