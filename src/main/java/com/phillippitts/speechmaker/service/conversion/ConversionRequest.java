package com.phillippitts.speechmaker.service.conversion;

import com.phillippitts.speechmaker.domain.OutputFormat;

import java.nio.file.Path;

/**
 * Parameters of a conversion. Null speed, format or folder fall back to the configured defaults.
 *
 * @param text text to speak
 * @param voiceId engine voice id
 * @param speed playback speed, 0.5-2.0
 * @param outputFormat requested container
 * @param outputFolder target folder
 */
public record ConversionRequest(
        String text,
        String voiceId,
        Double speed,
        OutputFormat outputFormat,
        Path outputFolder
) {
    public ConversionRequest withText(String newText) {
        return new ConversionRequest(newText, voiceId, speed, outputFormat, outputFolder);
    }
}
