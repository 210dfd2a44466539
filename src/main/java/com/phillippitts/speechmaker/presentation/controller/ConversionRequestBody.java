package com.phillippitts.speechmaker.presentation.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * JSON body of {@code POST /api/conversions}. Exactly one of {@code text} and {@code filePath}
 * is expected; {@code filePath} wins when both are present.
 */
record ConversionRequestBody(
        String text,
        String filePath,
        @NotBlank(message = "voiceId is required") String voiceId,
        @DecimalMin(value = "0.5", message = "speed must be at least 0.5")
        @DecimalMax(value = "2.0", message = "speed must be at most 2.0") Double speed,
        @Pattern(regexp = "(?i)wav|mp3", message = "outputFormat must be wav or mp3") String outputFormat,
        String outputFolder
) {}
