package com.phillippitts.speechmaker.service.readiness;

import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.ResourceSource;

import java.nio.file.Path;

/**
 * Immutable view of readiness, as rendered by the UI and the health endpoint.
 *
 * @param ready a conversion may start
 * @param initializing startup probing is still running
 * @param voicesLoaded the voice catalog is non-empty
 * @param voicesLoading a voice resolution is running
 * @param voiceCount number of voices
 * @param voiceAttempts listing attempts of the last resolution
 * @param showRetry offer a voice reload ({@code attempts > 0 && !loaded})
 * @param showTroubleshooting show troubleshooting steps ({@code attempts >= 3})
 * @param voiceError last voice listing failure, null if none
 * @param converterSource where the converter was found, NONE when missing or not yet probed
 * @param mp3Selectable MP3 output is possible
 * @param outputFolderSet the user chose an output folder
 * @param outputFolder folder conversions write to, null if none is known
 * @param statusMessage one-line summary for the status bar
 */
public record ReadinessSnapshot(
        boolean ready,
        boolean initializing,
        boolean voicesLoaded,
        boolean voicesLoading,
        int voiceCount,
        int voiceAttempts,
        boolean showRetry,
        boolean showTroubleshooting,
        ErrorRecord voiceError,
        ResourceSource converterSource,
        boolean mp3Selectable,
        boolean outputFolderSet,
        Path outputFolder,
        String statusMessage
) {}
