package com.phillippitts.speechmaker.service.readiness;

import com.phillippitts.speechmaker.config.properties.ReadinessProperties;
import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.ResourceStatus;
import com.phillippitts.speechmaker.service.output.OutputFolders;
import com.phillippitts.speechmaker.service.resource.ResolveMode;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Feeds resource resolution results into the {@link ReadinessStateMachine}.
 *
 * <p>On {@link ApplicationReadyEvent} (unless {@code readiness.startup-probe=false}) the voice
 * catalog is resolved in fast-start mode and the converter is detected, concurrently. When both have
 * settled, initialization ends. A failed probe still ends initialization; the snapshot then shows
 * why the app is not ready.
 */
public class ReadinessInitializer {

    private static final Logger LOG = LogManager.getLogger(ReadinessInitializer.class);

    private final ResourceResolver resolver;
    private final ReadinessStateMachine stateMachine;
    private final OutputFolders outputFolders;
    private final ReadinessProperties properties;

    public ReadinessInitializer(ResourceResolver resolver, ReadinessStateMachine stateMachine,
                                OutputFolders outputFolders, ReadinessProperties properties) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.outputFolders = Objects.requireNonNull(outputFolders, "outputFolders");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isStartupProbe()) {
            LOG.info("Startup probing disabled (readiness.startup-probe=false)");
            return;
        }
        initialize();
    }

    /**
     * Runs the startup probes.
     *
     * @return completes when initialization has ended
     */
    public CompletableFuture<ReadinessSnapshot> initialize() {
        stateMachine.updateInitializing(true);
        stateMachine.updateOutputFolder(false, outputFolders.defaultFolder());
        stateMachine.updateVoices(VoiceState.loading(0));

        CompletableFuture<ResourceStatus> voices = resolver
                .resolveAsync(ResourceKind.VOICE_CATALOG, ResolveMode.FAST_START)
                .whenComplete((status, error) -> {
                    if (status != null) {
                        stateMachine.updateVoices(VoiceState.from(status));
                    }
                });
        CompletableFuture<ResourceStatus> converter = resolver
                .resolveAsync(ResourceKind.AUDIO_CONVERTER, ResolveMode.NORMAL)
                .whenComplete((status, error) -> {
                    if (status != null) {
                        stateMachine.updateConverter(status);
                    }
                });

        return CompletableFuture.allOf(voices, converter)
                .handle((ignored, error) -> {
                    if (error != null) {
                        LOG.error("Startup probing failed", error);
                    }
                    stateMachine.updateInitializing(false);
                    ReadinessSnapshot snapshot = stateMachine.snapshot();
                    LOG.info("Startup readiness: {}", snapshot.statusMessage());
                    return snapshot;
                });
    }

    /**
     * Drops the cached catalog and lists voices again (user retry).
     *
     * @return completes with the snapshot after the reload
     */
    public CompletableFuture<ReadinessSnapshot> reloadVoices() {
        int previousAttempts = stateMachine.snapshot().voiceAttempts();
        resolver.clear(ResourceKind.VOICE_CATALOG);
        stateMachine.updateVoices(VoiceState.loading(previousAttempts));
        return resolver.resolveAsync(ResourceKind.VOICE_CATALOG, ResolveMode.NORMAL)
                .thenApply(status -> {
                    stateMachine.updateVoices(VoiceState.from(status));
                    return stateMachine.snapshot();
                });
    }
}
