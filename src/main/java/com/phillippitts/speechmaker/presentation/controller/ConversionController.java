package com.phillippitts.speechmaker.presentation.controller;

import com.phillippitts.speechmaker.domain.ConversionSession;
import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.service.conversion.ConversionRequest;
import com.phillippitts.speechmaker.service.conversion.ConversionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Starts, inspects, cancels and retries conversion sessions. Conversions run in the background;
 * clients poll {@code GET /api/conversions/{id}}.
 */
@RestController
@RequestMapping("/api/conversions")
class ConversionController {

    private static final Logger LOG = LogManager.getLogger(ConversionController.class);

    private final ConversionService conversionService;

    ConversionController(ConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @PostMapping
    ResponseEntity<SessionView> start(@Valid @RequestBody ConversionRequestBody body) {
        ConversionRequest request = new ConversionRequest(
                body.text(),
                body.voiceId(),
                body.speed(),
                body.outputFormat() == null ? null : OutputFormat.fromString(body.outputFormat()),
                toPath(body.outputFolder()));

        ConversionSession session;
        if (body.filePath() != null && !body.filePath().isBlank()) {
            LOG.info("Conversion requested from file");
            session = conversionService.startFromFile(Paths.get(body.filePath().trim()), request);
        } else {
            session = conversionService.start(request);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionView.of(session));
    }

    @GetMapping
    List<SessionView> list() {
        return conversionService.list().stream().map(SessionView::of).toList();
    }

    @GetMapping("/{id}")
    ResponseEntity<SessionView> get(@PathVariable("id") String id) {
        return conversionService.find(id)
                .map(s -> ResponseEntity.ok(SessionView.of(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Map<String, Object>> cancel(@PathVariable("id") String id) {
        if (conversionService.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = conversionService.cancel(id);
        return ResponseEntity.status(cancelled ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
                .body(Map.of("id", id, "cancelRequested", cancelled));
    }

    @PostMapping("/{id}/retry")
    ResponseEntity<SessionView> retry(@PathVariable("id") String id) {
        if (conversionService.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionView.of(conversionService.retry(id)));
    }

    @DeleteMapping("/{id}/files")
    ResponseEntity<Map<String, Object>> discard(@PathVariable("id") String id) {
        int removed = conversionService.discard(id);
        if (removed < 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", id, "removed", removed));
    }

    private static Path toPath(String folder) {
        return folder == null || folder.isBlank() ? null : Paths.get(folder.trim());
    }
}
