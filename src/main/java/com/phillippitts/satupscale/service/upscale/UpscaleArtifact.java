package com.phillippitts.satupscale.service.upscale;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outputs produced for one input once its fallback chains finished.
 *
 * @param notes human-readable record of every fallback taken; empty when the preferred path ran
 */
public record UpscaleArtifact(Path inputPath, Path masterOutputPath, Path visualOutputPath, List<String> notes) {

    public UpscaleArtifact {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(masterOutputPath, "masterOutputPath");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public Optional<Path> visualOutput() {
        return Optional.ofNullable(visualOutputPath);
    }
}
