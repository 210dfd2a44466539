package com.phillippitts.speechmaker.service.conversion.event;

/**
 * Progress phases of a session, with the percentage range each one reports.
 */
public enum ConversionPhase {
    /** 20-80%, proportional to finished chunks. */
    SYNTHESIZING,
    /** 85%. */
    MERGING,
    /** 90%, MP3 only. */
    TRANSCODING,
    /** 100%. */
    COMPLETE
}
