package com.phillippitts.speechmaker.presentation.controller;

import com.phillippitts.speechmaker.domain.ResourceKind;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.service.output.OutputFolders;
import com.phillippitts.speechmaker.service.readiness.ReadinessInitializer;
import com.phillippitts.speechmaker.service.readiness.ReadinessSnapshot;
import com.phillippitts.speechmaker.service.readiness.ReadinessStateMachine;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Readiness, voice catalog and output folder selection.
 */
@RestController
class ReadinessController {

    private final ReadinessStateMachine readiness;
    private final ReadinessInitializer initializer;
    private final ResourceResolver resolver;
    private final OutputFolders outputFolders;

    ReadinessController(ReadinessStateMachine readiness, ReadinessInitializer initializer,
                        ResourceResolver resolver, OutputFolders outputFolders) {
        this.readiness = readiness;
        this.initializer = initializer;
        this.resolver = resolver;
        this.outputFolders = outputFolders;
    }

    @GetMapping("/api/readiness")
    ReadinessSnapshot readiness() {
        return readiness.snapshot();
    }

    /** Starts a voice reload and returns immediately; poll readiness for the result. */
    @PostMapping("/api/readiness/voices/reload")
    ResponseEntity<ReadinessSnapshot> reloadVoices() {
        initializer.reloadVoices();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(readiness.snapshot());
    }

    @PutMapping("/api/readiness/output-folder")
    ReadinessSnapshot selectOutputFolder(@Valid @RequestBody OutputFolderBody body) {
        Path folder = outputFolders.ensure(Paths.get(body.path().trim()));
        readiness.selectOutputFolder(folder);
        return readiness.snapshot();
    }

    /** Cached catalog only; never triggers a listing. */
    @GetMapping("/api/voices")
    List<Voice> voices() {
        return resolver.cached(ResourceKind.VOICE_CATALOG)
                .map(status -> status.voices())
                .orElse(List.of());
    }

    record OutputFolderBody(@NotBlank(message = "path is required") String path) {}
}
