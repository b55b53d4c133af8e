package com.phillippitts.satupscale.service.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One request to run an external super-resolution model on a single input.
 *
 * @param modelVersion installed version, or null for the "latest" installation
 * @param cacheDir model cache root overriding the configured one (may be null)
 * @param scale upscale factor passed as {@code --scale}, or null to let the model decide
 */
public record ModelInvocation(
        String modelName,
        String modelVersion,
        Path cacheDir,
        Path inputPath,
        Path outputPath,
        Integer scale,
        String tiling,
        String precision,
        String compute
) {

    public ModelInvocation {
        Objects.requireNonNull(modelName, "modelName");
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
    }
}
