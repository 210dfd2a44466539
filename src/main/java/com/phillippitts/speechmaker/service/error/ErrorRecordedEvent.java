package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorRecord;

/**
 * Published after every classification.
 *
 * @param record the classified error
 */
public record ErrorRecordedEvent(ErrorRecord record) {
}
