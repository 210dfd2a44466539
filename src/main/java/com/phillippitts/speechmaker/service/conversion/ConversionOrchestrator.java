package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.domain.ConversionSession;
import com.phillippitts.speechmaker.exception.SessionFailedException;

import java.nio.file.Path;

/**
 * Drives one conversion session from chunk synthesis to the final artifact.
 */
public interface ConversionOrchestrator {

    /**
     * Runs the session on the calling thread until it is terminal.
     *
     * @param session a PENDING session
     * @return path of the final artifact
     * @throws SessionFailedException when the session ends FAILED or CANCELLED; carries the
     *         classified error and the session's chunk jobs
     */
    Path convert(ConversionSession session);
}
