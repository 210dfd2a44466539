package com.phillippitts.speechmaker.exception;

import com.phillippitts.speechmaker.domain.ChunkJob;
import com.phillippitts.speechmaker.domain.ErrorRecord;

import java.util.List;

/**
 * Terminal outcome of a failed or cancelled conversion session. Carries the classified error and the
 * session's chunk jobs; chunk files of a failed session are retained for the caller to clean up.
 */
public class SessionFailedException extends ClassifiedException {

    private final String sessionId;
    private final transient List<ChunkJob> chunks;

    public SessionFailedException(String sessionId, ErrorRecord record, List<ChunkJob> chunks, Throwable cause) {
        super(record, cause);
        this.sessionId = sessionId;
        this.chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public String getSessionId() {
        return sessionId;
    }

    /** All chunk jobs of the session in index order, including the ones that never ran. */
    public List<ChunkJob> getChunks() {
        return chunks;
    }
}
