package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.domain.OutputFormat;
import com.phillippitts.speechmaker.domain.Voice;
import com.phillippitts.speechmaker.util.CancellationToken;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * External text-to-speech engine.
 *
 * <p>Implementations throw unchecked exceptions from the application hierarchy; callers route
 * them through the error classifier.
 */
public interface VoiceEngine {

    /**
     * Lists the voices the engine offers.
     *
     * @param timeout bound on the listing call
     * @return voices in engine order; may be empty
     */
    List<Voice> listVoices(Duration timeout);

    /**
     * Container the engine writes, whatever the target file is called. Chunk files are named with
     * its extension.
     */
    OutputFormat audioFormat();

    /**
     * Synthesizes one chunk of text into an audio file.
     *
     * @param text chunk text, non-empty
     * @param voiceId engine voice id
     * @param speed playback speed, 1.0 is normal
     * @param output file to write
     * @param token cancellation signal; cancelling stops the engine process
     * @return the written file
     */
    Path synthesize(String text, String voiceId, double speed, Path output, CancellationToken token);
}
