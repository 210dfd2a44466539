package com.phillippitts.speechmaker.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the edge-tts command line voice engine.
 */
@ConfigurationProperties(prefix = "tts.engine")
@Validated
public class VoiceEngineProperties {

    /** Executable name or absolute path. */
    @NotBlank(message = "Voice engine binary must not be blank")
    private String binary = "edge-tts";

    /** Timeout for {@code --list-voices} on a normal resolution. */
    @Positive
    private long listTimeoutMs = 5000;

    /** Reduced listing timeout used while the application is starting. */
    @Positive
    private long fastStartListTimeoutMs = 3000;

    /** Upper bound for one chunk synthesis. */
    @Positive
    private int synthesisTimeoutSeconds = 120;

    /** Cap on captured stdout (the voice list is the largest output). */
    @Positive
    private int maxStdoutBytes = 1024 * 1024;

    /** Engine processes allowed to run at the same time across all sessions. */
    @Positive
    private int maxConcurrentProcesses = 4;

    /** How long a synthesis waits for a free process slot. */
    @Positive
    private long acquireTimeoutMs = 30_000;

    public String getBinary() {
        return binary;
    }

    public void setBinary(String binary) {
        this.binary = binary;
    }

    public long getListTimeoutMs() {
        return listTimeoutMs;
    }

    public void setListTimeoutMs(long listTimeoutMs) {
        this.listTimeoutMs = listTimeoutMs;
    }

    public long getFastStartListTimeoutMs() {
        return fastStartListTimeoutMs;
    }

    public void setFastStartListTimeoutMs(long fastStartListTimeoutMs) {
        this.fastStartListTimeoutMs = fastStartListTimeoutMs;
    }

    public int getSynthesisTimeoutSeconds() {
        return synthesisTimeoutSeconds;
    }

    public void setSynthesisTimeoutSeconds(int synthesisTimeoutSeconds) {
        this.synthesisTimeoutSeconds = synthesisTimeoutSeconds;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    public int getMaxConcurrentProcesses() {
        return maxConcurrentProcesses;
    }

    public void setMaxConcurrentProcesses(int maxConcurrentProcesses) {
        this.maxConcurrentProcesses = maxConcurrentProcesses;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
