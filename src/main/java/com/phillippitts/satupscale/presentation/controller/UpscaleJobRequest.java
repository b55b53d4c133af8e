package com.phillippitts.satupscale.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * JSON body of {@code POST /api/jobs}.
 *
 * @param inputs files or folders to upscale; folders are expanded recursively
 * @param outputDir output directory, or null for the configured default
 * @param bandHandling band policy label, e.g. "RGB only"; null means RGB only
 * @param report whether to export {@code processing_report.json} into the output directory
 */
public record UpscaleJobRequest(
        @NotEmpty(message = "At least one input is required")
        List<@NotBlank String> inputs,
        String outputDir,
        @Positive(message = "Scale must be positive")
        int scale,
        @NotBlank(message = "Master format is required")
        String masterFormat,
        String visualFormat,
        String bandHandling,
        String modelName,
        String modelVersion,
        String outputTag,
        String tiling,
        String precision,
        String compute,
        boolean report
) {
}
