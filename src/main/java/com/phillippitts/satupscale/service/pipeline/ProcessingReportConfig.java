package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.service.upscale.ExportSettings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What to record in a processing report and where to write it.
 *
 * @param modelVersion explicit version; when null it is looked up in the model registry
 * @param registryPath registry to look the version up in, or null for the configured default
 */
public record ProcessingReportConfig(
        ExportSettings exportSettings,
        String modelName,
        Path reportPath,
        Integer scale,
        String tiling,
        String precision,
        String compute,
        String modelVersion,
        Path registryPath
) {

    public ProcessingReportConfig {
        Objects.requireNonNull(exportSettings, "exportSettings");
        Objects.requireNonNull(reportPath, "reportPath");
    }

    public static Builder builder(ExportSettings exportSettings, String modelName, Path reportPath) {
        return new Builder(exportSettings, modelName, reportPath);
    }

    public static final class Builder {
        private final ExportSettings exportSettings;
        private final String modelName;
        private final Path reportPath;
        private Integer scale;
        private String tiling;
        private String precision;
        private String compute;
        private String modelVersion;
        private Path registryPath;

        private Builder(ExportSettings exportSettings, String modelName, Path reportPath) {
            this.exportSettings = exportSettings;
            this.modelName = modelName;
            this.reportPath = reportPath;
        }

        public Builder scale(Integer scale) {
            this.scale = scale;
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

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder registryPath(Path registryPath) {
            this.registryPath = registryPath;
            return this;
        }

        public ProcessingReportConfig build() {
            return new ProcessingReportConfig(exportSettings, modelName, reportPath, scale, tiling, precision,
                    compute, modelVersion, registryPath);
        }
    }
}
