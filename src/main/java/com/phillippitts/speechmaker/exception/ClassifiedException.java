package com.phillippitts.speechmaker.exception;

import com.phillippitts.speechmaker.domain.ErrorRecord;

import java.util.Objects;

/**
 * A failure that has already been through the error classifier. Carries the resulting
 * {@link ErrorRecord} to the boundary so it is not classified (and logged) twice.
 */
public class ClassifiedException extends SpeechMakerException {

    private final transient ErrorRecord record;

    public ClassifiedException(ErrorRecord record, Throwable cause) {
        super(Objects.requireNonNull(record, "record").userMessage(), record.code(), cause);
        this.record = record;
    }

    public ErrorRecord getRecord() {
        return record;
    }
}
