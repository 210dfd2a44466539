package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import com.phillippitts.speechmaker.domain.Severity;

import java.time.Instant;
import java.util.Map;

/**
 * Diagnostics summary of the error log.
 *
 * @param total records classified since the last clear (including evicted ones)
 * @param retained records currently held in the ring
 * @param byCategory cumulative count per category since the last clear
 * @param bySeverity cumulative count per severity since the last clear
 * @param critical cumulative count of critical records
 * @param lastRecordedAt timestamp of the newest record, null when empty
 */
public record ErrorStats(
        long total,
        int retained,
        Map<ErrorCategory, Long> byCategory,
        Map<Severity, Long> bySeverity,
        long critical,
        Instant lastRecordedAt
) {
    public ErrorStats {
        byCategory = Map.copyOf(byCategory);
        bySeverity = Map.copyOf(bySeverity);
    }
}
