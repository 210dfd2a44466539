package com.phillippitts.speechmaker.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the ffmpeg audio converter: where to look for it and how to invoke it.
 *
 * <p>When {@code bundledPath} is blank the bundled candidate is
 * {@code <resourcesDir>/ffmpeg/<os>/<arch>/ffmpeg[.exe]}.
 */
@ConfigurationProperties(prefix = "converter")
@Validated
public class ConverterProperties {

    private String bundledPath = "";

    @NotBlank
    private String resourcesDir = "resources";

    /** Executable searched on the PATH. */
    @NotBlank
    private String executableName = "ffmpeg";

    /** Bounded wait for the system-wide lookup and validation. */
    @Positive
    private long detectionTimeoutMs = 3000;

    @Positive
    private int conversionTimeoutSeconds = 300;

    @NotBlank
    private String mp3Bitrate = "128k";

    @Positive
    private int sampleRate = 44100;

    public String getBundledPath() {
        return bundledPath;
    }

    public void setBundledPath(String bundledPath) {
        this.bundledPath = bundledPath;
    }

    public String getResourcesDir() {
        return resourcesDir;
    }

    public void setResourcesDir(String resourcesDir) {
        this.resourcesDir = resourcesDir;
    }

    public String getExecutableName() {
        return executableName;
    }

    public void setExecutableName(String executableName) {
        this.executableName = executableName;
    }

    public long getDetectionTimeoutMs() {
        return detectionTimeoutMs;
    }

    public void setDetectionTimeoutMs(long detectionTimeoutMs) {
        this.detectionTimeoutMs = detectionTimeoutMs;
    }

    public int getConversionTimeoutSeconds() {
        return conversionTimeoutSeconds;
    }

    public void setConversionTimeoutSeconds(int conversionTimeoutSeconds) {
        this.conversionTimeoutSeconds = conversionTimeoutSeconds;
    }

    public String getMp3Bitrate() {
        return mp3Bitrate;
    }

    public void setMp3Bitrate(String mp3Bitrate) {
        this.mp3Bitrate = mp3Bitrate;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }
}
