package com.phillippitts.speechmaker.service.health;

import com.phillippitts.speechmaker.service.readiness.ReadinessSnapshot;
import com.phillippitts.speechmaker.service.readiness.ReadinessStateMachine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Health indicator for conversion readiness.
 *
 * <ul>
 *   <li>UP: ready, MP3 available</li>
 *   <li>DEGRADED: ready, converter missing (WAV only)</li>
 *   <li>OUT_OF_SERVICE: still initializing</li>
 *   <li>DOWN: no voices, or no output folder</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ReadinessStateMachine readiness;

    public ReadinessHealthIndicator(ReadinessStateMachine readiness) {
        this.readiness = readiness;
    }

    @Override
    public Health health() {
        ReadinessSnapshot s = readiness.snapshot();
        Health.Builder builder;
        if (s.initializing()) {
            builder = Health.outOfService();
        } else if (s.ready() && s.mp3Selectable()) {
            builder = Health.up();
        } else if (s.ready()) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.down();
        }

        builder.withDetail("status", s.statusMessage())
                .withDetail("voices", s.voicesLoaded() ? s.voiceCount() + " loaded" : "unavailable")
                .withDetail("converter", s.converterSource().name().toLowerCase(Locale.ROOT))
                .withDetail("mp3", s.mp3Selectable());
        if (s.voiceError() != null) {
            builder.withDetail("voiceError", s.voiceError().userMessage());
        }
        return builder.build();
    }
}
