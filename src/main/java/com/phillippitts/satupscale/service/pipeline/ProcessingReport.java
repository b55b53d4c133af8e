package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.util.TimeUtils;
import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Summary of a completed job: settings used, model identity and timings.
 *
 * <p>Serialized as
 * <pre>
 * {"settings": {"band_handling", "output_format", "scale", "tiling", "precision", "compute"},
 *  "model": {"name", "version"},
 *  "timings": {"started_at", "completed_at", "duration_ms"}}
 * </pre>
 * with unset settings written as JSON null.
 */
public record ProcessingReport(Settings settings, Model model, Timings timings) {

    public record Settings(String bandHandling, String outputFormat, Integer scale, String tiling,
                           String precision, String compute) { }

    public record Model(String name, String version) { }

    /**
     * @param startedAt ISO-8601 UTC timestamp, second precision
     */
    public record Timings(String startedAt, String completedAt, long durationMs) {

        /**
         * @throws IllegalArgumentException if {@code completedAt} is before {@code startedAt}
         */
        public static Timings between(Instant startedAt, Instant completedAt) {
            long durationMs = Duration.between(startedAt, completedAt).toMillis();
            if (durationMs < 0) {
                throw new IllegalArgumentException("completed_at must be after started_at");
            }
            return new Timings(TimeUtils.formatUtcSeconds(startedAt), TimeUtils.formatUtcSeconds(completedAt),
                    durationMs);
        }
    }

    public ProcessingReport {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(timings, "timings");
    }

    /**
     * Builds a report, resolving the model version from the registry when the config has none.
     *
     * @throws IllegalArgumentException if the model name is blank
     */
    public static ProcessingReport build(ProcessingReportConfig config, Timings timings,
                                         ModelVersionResolver versions) {
        if (config.modelName() == null || config.modelName().isBlank()) {
            throw new IllegalArgumentException("model name must be provided");
        }
        String version = config.modelVersion() != null && !config.modelVersion().isBlank()
                ? config.modelVersion()
                : versions.resolve(config.modelName(), config.registryPath());
        Settings settings = new Settings(
                config.exportSettings().bandHandling().label(),
                config.exportSettings().outputFormat(),
                config.scale(),
                config.tiling(),
                config.precision(),
                config.compute());
        return new ProcessingReport(settings, new Model(config.modelName(), version), timings);
    }

    public JSONObject toJson() {
        JSONObject settingsJson = new JSONObject();
        settingsJson.put("band_handling", settings.bandHandling());
        settingsJson.put("output_format", settings.outputFormat());
        settingsJson.put("scale", nullable(settings.scale()));
        settingsJson.put("tiling", nullable(settings.tiling()));
        settingsJson.put("precision", nullable(settings.precision()));
        settingsJson.put("compute", nullable(settings.compute()));

        JSONObject modelJson = new JSONObject();
        modelJson.put("name", model.name());
        modelJson.put("version", model.version());

        JSONObject timingsJson = new JSONObject();
        timingsJson.put("started_at", timings.startedAt());
        timingsJson.put("completed_at", timings.completedAt());
        timingsJson.put("duration_ms", timings.durationMs());

        JSONObject root = new JSONObject();
        root.put("settings", settingsJson);
        root.put("model", modelJson);
        root.put("timings", timingsJson);
        return root;
    }

    private static Object nullable(Object value) {
        return value == null ? JSONObject.NULL : value;
    }
}
