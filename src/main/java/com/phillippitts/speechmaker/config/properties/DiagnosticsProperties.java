package com.phillippitts.speechmaker.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Error diagnostics settings.
 */
@ConfigurationProperties(prefix = "diagnostics")
@Validated
public class DiagnosticsProperties {

    /** Entries kept in the in-memory error log; oldest are evicted first. */
    @Positive(message = "Error log capacity must be positive")
    private int errorLogCapacity = 1000;

    public int getErrorLogCapacity() {
        return errorLogCapacity;
    }

    public void setErrorLogCapacity(int errorLogCapacity) {
        this.errorLogCapacity = errorLogCapacity;
    }
}
