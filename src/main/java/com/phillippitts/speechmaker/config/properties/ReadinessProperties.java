package com.phillippitts.speechmaker.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Startup readiness settings.
 */
@ConfigurationProperties(prefix = "readiness")
public class ReadinessProperties {

    /** Resolve voices and converter once the application is ready. Disabled in tests. */
    private boolean startupProbe = true;

    public boolean isStartupProbe() {
        return startupProbe;
    }

    public void setStartupProbe(boolean startupProbe) {
        this.startupProbe = startupProbe;
    }
}
