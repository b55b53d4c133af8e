package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.raster.GridSignature;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One input file to upscale, with the outputs and processing options chosen for it.
 *
 * <p>Optional components are null when unset. {@code scale} is validated when the request runs.
 *
 * @param rgbMapping band mapping for visual outputs, or null for the band-count default
 * @param reprojectTo target grid for the geospatial master, or null to keep the source grid
 * @param modelName external model to try first, or null for the built-in resize only
 * @param outputTag free text folded into output file names, e.g. the model name
 */
public record UpscaleRequest(
        Path inputPath,
        OutputPlan outputPlan,
        int scale,
        BandHandling bandHandling,
        RgbBandMapping rgbMapping,
        GridSignature reprojectTo,
        String modelName,
        String modelVersion,
        Path modelCacheDir,
        String tiling,
        String precision,
        String compute,
        String outputTag
) {

    public UpscaleRequest {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPlan, "outputPlan");
        Objects.requireNonNull(bandHandling, "bandHandling");
    }

    public boolean hasModel() {
        return modelName != null && !modelName.isBlank();
    }

    public static Builder builder(Path inputPath, OutputPlan outputPlan, int scale) {
        return new Builder(inputPath, outputPlan, scale);
    }

    public static final class Builder {
        private final Path inputPath;
        private final OutputPlan outputPlan;
        private final int scale;
        private BandHandling bandHandling = BandHandling.RGB_ONLY;
        private RgbBandMapping rgbMapping;
        private GridSignature reprojectTo;
        private String modelName;
        private String modelVersion;
        private Path modelCacheDir;
        private String tiling;
        private String precision;
        private String compute;
        private String outputTag;

        private Builder(Path inputPath, OutputPlan outputPlan, int scale) {
            this.inputPath = inputPath;
            this.outputPlan = outputPlan;
            this.scale = scale;
        }

        public Builder bandHandling(BandHandling bandHandling) {
            this.bandHandling = bandHandling;
            return this;
        }

        public Builder rgbMapping(RgbBandMapping rgbMapping) {
            this.rgbMapping = rgbMapping;
            return this;
        }

        public Builder reprojectTo(GridSignature reprojectTo) {
            this.reprojectTo = reprojectTo;
            return this;
        }

        public Builder model(String name, String version) {
            this.modelName = name;
            this.modelVersion = version;
            return this;
        }

        public Builder modelCacheDir(Path modelCacheDir) {
            this.modelCacheDir = modelCacheDir;
            return this;
        }

        public Builder tiling(String tiling) {
            this.tiling = tiling;
            return this;
        }

        public Builder precision(String precision) {
            this.precision = precision;
            return this;
        }

        public Builder compute(String compute) {
            this.compute = compute;
            return this;
        }

        public Builder outputTag(String outputTag) {
            this.outputTag = outputTag;
            return this;
        }

        public UpscaleRequest build() {
            return new UpscaleRequest(inputPath, outputPlan, scale, bandHandling, rgbMapping, reprojectTo,
                    modelName, modelVersion, modelCacheDir, tiling, precision, compute, outputTag);
        }
    }
}
