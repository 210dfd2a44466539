package com.phillippitts.speechmaker.service.converter;

/**
 * PCM layout of a WAV file, as read from its {@code fmt } chunk.
 *
 * @param channels channel count
 * @param sampleRate samples per second
 * @param bitsPerSample bits per sample
 */
record WavFormat(int channels, int sampleRate, int bitsPerSample) {

    /** RIFF header size written by {@link WavConcatenator}. */
    static final int HEADER_SIZE = 44;

    /** PCM audio format tag in the {@code fmt } chunk. */
    static final int PCM_FORMAT_TAG = 1;

    int blockAlign() {
        return channels * bitsPerSample / 8;
    }

    int byteRate() {
        return sampleRate * blockAlign();
    }
}
