package com.phillippitts.speechmaker.exception;

/**
 * Thrown when the engine offers no voices at all, or the requested voice is not among them.
 */
public class VoiceUnavailableException extends SpeechMakerException {

    private final String voiceId;

    private VoiceUnavailableException(String message, String code, String voiceId) {
        super(message, code);
        this.voiceId = voiceId;
    }

    public static VoiceUnavailableException noVoices() {
        return new VoiceUnavailableException("No voices available from the speech engine",
                ErrorCodes.VOICES_EMPTY, null);
    }

    public static VoiceUnavailableException notFound(String voiceId) {
        return new VoiceUnavailableException("Voice '" + voiceId + "' not found",
                ErrorCodes.VOICE_NOT_FOUND, voiceId);
    }

    /** Requested voice id; null for {@link #noVoices()}. */
    public String getVoiceId() {
        return voiceId;
    }
}
