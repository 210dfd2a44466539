package com.phillippitts.speechmaker.presentation.controller;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.service.error.ErrorLog;
import com.phillippitts.speechmaker.service.error.ErrorStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the classified error log.
 */
@RestController
@RequestMapping("/api/diagnostics/errors")
class DiagnosticsController {

    private static final Logger LOG = LogManager.getLogger(DiagnosticsController.class);

    static final int MAX_LIMIT = 1000;

    private final ErrorLog errorLog;

    DiagnosticsController(ErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    @GetMapping
    List<ErrorRecord> recent(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return errorLog.recent(Math.max(0, Math.min(limit, MAX_LIMIT)));
    }

    @GetMapping("/stats")
    ErrorStats stats() {
        return errorLog.stats();
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        errorLog.clear();
        LOG.info("Error log cleared");
        return ResponseEntity.noContent().build();
    }
}
