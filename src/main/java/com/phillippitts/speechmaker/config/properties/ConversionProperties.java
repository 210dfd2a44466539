package com.phillippitts.speechmaker.config.properties;

import com.phillippitts.speechmaker.domain.OutputFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Conversion settings: chunk sizing, worker concurrency, output defaults and input limits.
 *
 * <p>Note: Bean created via {@link com.phillippitts.speechmaker.SpeechMakerApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public class ConversionProperties {

    /** Maximum characters per synthesized chunk. */
    @Min(value = 1000, message = "Max chunk length must be at least 1000 characters")
    @Max(value = 10000, message = "Max chunk length must be at most 10000 characters")
    private int maxChunkLength = 5000;

    /** Chunks synthesized simultaneously within one session. */
    @Min(value = 1, message = "At least one chunk worker is required")
    @Max(value = 8, message = "At most 8 chunk workers are allowed")
    private int maxConcurrentChunks = 3;

    @NotNull
    private OutputFormat defaultOutputFormat = OutputFormat.WAV;

    @DecimalMin(value = "0.5", message = "Voice speed must be at least 0.5")
    @DecimalMax(value = "2.0", message = "Voice speed must be at most 2.0")
    private double voiceSpeed = 1.0;

    /** Output folder used when the caller does not choose one. Blank means ~/Documents/SpeechMaker. */
    private String defaultOutputPath = "";

    /** Largest accepted source text file (10 MB). */
    @Positive(message = "Max text file size must be positive")
    private long maxTextFileSizeBytes = 10L * 1024 * 1024;

    /** Scratch root for per-session chunk files. Blank means the system temp directory. */
    private String workDir = "";

    /** Finished sessions kept addressable for status, retry and discard; older ones are evicted. */
    @Min(value = 1, message = "At least one finished session must be retained")
    private int retainedSessions = 50;

    public int getMaxChunkLength() {
        return maxChunkLength;
    }

    public void setMaxChunkLength(int maxChunkLength) {
        this.maxChunkLength = maxChunkLength;
    }

    public int getMaxConcurrentChunks() {
        return maxConcurrentChunks;
    }

    public void setMaxConcurrentChunks(int maxConcurrentChunks) {
        this.maxConcurrentChunks = maxConcurrentChunks;
    }

    public OutputFormat getDefaultOutputFormat() {
        return defaultOutputFormat;
    }

    public void setDefaultOutputFormat(OutputFormat defaultOutputFormat) {
        this.defaultOutputFormat = defaultOutputFormat;
    }

    public double getVoiceSpeed() {
        return voiceSpeed;
    }

    public void setVoiceSpeed(double voiceSpeed) {
        this.voiceSpeed = voiceSpeed;
    }

    public String getDefaultOutputPath() {
        return defaultOutputPath;
    }

    public void setDefaultOutputPath(String defaultOutputPath) {
        this.defaultOutputPath = defaultOutputPath;
    }

    public long getMaxTextFileSizeBytes() {
        return maxTextFileSizeBytes;
    }

    public void setMaxTextFileSizeBytes(long maxTextFileSizeBytes) {
        this.maxTextFileSizeBytes = maxTextFileSizeBytes;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public int getRetainedSessions() {
        return retainedSessions;
    }

    public void setRetainedSessions(int retainedSessions) {
        this.retainedSessions = retainedSessions;
    }
}
