package com.phillippitts.speechmaker.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Exponential backoff settings shared by chunk synthesis and voice listing.
 *
 * <p>Delay for attempt {@code n} is {@code min(baseDelayMs * 2^n, capDelayMs)}.
 */
@ConfigurationProperties(prefix = "retry")
@Validated
public class RetryProperties {

    @Positive(message = "Base delay must be positive")
    private long baseDelayMs = 1000;

    @Positive(message = "Cap delay must be positive")
    private long capDelayMs = 10_000;

    /** Synthesis attempts per chunk, first try included. */
    @Min(value = 1, message = "Chunk attempts must be at least 1")
    private int maxChunkAttempts = 3;

    /** Voice listing attempts, first try included. */
    @Min(value = 2, message = "Voice list attempts must be at least 2")
    private int voiceListMaxAttempts = 3;

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getCapDelayMs() {
        return capDelayMs;
    }

    public void setCapDelayMs(long capDelayMs) {
        this.capDelayMs = capDelayMs;
    }

    public int getMaxChunkAttempts() {
        return maxChunkAttempts;
    }

    public void setMaxChunkAttempts(int maxChunkAttempts) {
        this.maxChunkAttempts = maxChunkAttempts;
    }

    public int getVoiceListMaxAttempts() {
        return voiceListMaxAttempts;
    }

    public void setVoiceListMaxAttempts(int voiceListMaxAttempts) {
        this.voiceListMaxAttempts = voiceListMaxAttempts;
    }
}
