package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.service.upscale.BandHandling;
import com.phillippitts.satupscale.service.upscale.ExportSettings;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingReportTest {

    @TempDir
    Path tempDir;

    private static final Instant START = Instant.parse("2024-05-01T12:00:00.750Z");
    private static final Instant END = Instant.parse("2024-05-01T12:00:05.250Z");

    @Test
    void timingsUseSecondPrecisionTimestampsAndMillisecondDuration() {
        ProcessingReport.Timings timings = ProcessingReport.Timings.between(START, END);

        assertThat(timings.startedAt()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(timings.completedAt()).isEqualTo("2024-05-01T12:00:05Z");
        assertThat(timings.durationMs()).isEqualTo(4500L);
    }

    @Test
    void timingsRejectCompletionBeforeStart() {
        assertThatThrownBy(() -> ProcessingReport.Timings.between(END, START))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void explicitModelVersionWinsOverRegistry() {
        ProcessingReportConfig config = ProcessingReportConfig.builder(
                        new ExportSettings(BandHandling.ALL_BANDS, "GeoTIFF"), "SatelliteSR", tempDir.resolve("r.json"))
                .modelVersion("2.1")
                .build();

        ProcessingReport report = ProcessingReport.build(config, ProcessingReport.Timings.between(START, END),
                new ModelVersionResolver(tempDir.resolve("missing.json")));

        assertThat(report.model().version()).isEqualTo("2.1");
        assertThat(report.settings().bandHandling()).isEqualTo("All bands");
    }

    @Test
    void versionFallsBackToRegistryLookup() throws Exception {
        Path registry = Files.writeString(tempDir.resolve("registry.json"),
                "[{\"name\": \"SatelliteSR\", \"weights_url\": \"https://example.org/releases/download/v0.1.0/w.pth\"}]");
        ProcessingReportConfig config = ProcessingReportConfig.builder(
                        new ExportSettings(BandHandling.RGB_ONLY, "PNG"), "SatelliteSR", tempDir.resolve("r.json"))
                .registryPath(registry)
                .build();

        ProcessingReport report = ProcessingReport.build(config, ProcessingReport.Timings.between(START, END),
                new ModelVersionResolver(tempDir.resolve("unused.json")));

        assertThat(report.model().version()).isEqualTo("v0.1.0");
    }

    @Test
    void blankModelNameIsRejected() {
        ProcessingReportConfig config = ProcessingReportConfig.builder(
                new ExportSettings(BandHandling.RGB_ONLY, "PNG"), " ", tempDir.resolve("r.json")).build();

        assertThatThrownBy(() -> ProcessingReport.build(config, ProcessingReport.Timings.between(START, END),
                new ModelVersionResolver(tempDir.resolve("registry.json"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("model name");
    }

    @Test
    void serializesUnsetSettingsAsJsonNull() {
        ProcessingReport report = new ProcessingReport(
                new ProcessingReport.Settings("RGB only", "PNG", 4, null, "fp16", null),
                new ProcessingReport.Model("SatelliteSR", "Unknown"),
                ProcessingReport.Timings.between(START, END));

        JSONObject json = report.toJson();

        JSONObject settings = json.getJSONObject("settings");
        assertThat(settings.getInt("scale")).isEqualTo(4);
        assertThat(settings.isNull("tiling")).isTrue();
        assertThat(settings.getString("precision")).isEqualTo("fp16");
        assertThat(settings.isNull("compute")).isTrue();
        assertThat(json.getJSONObject("model").getString("version")).isEqualTo("Unknown");
        assertThat(json.getJSONObject("timings").getLong("duration_ms")).isEqualTo(4500L);
    }

    @Test
    void writerReplacesExistingReportAndLeavesNoTempFile() throws Exception {
        Path target = tempDir.resolve("reports/processing_report.json");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "old");
        ProcessingReport report = new ProcessingReport(
                new ProcessingReport.Settings("RGB only", "PNG", null, null, null, null),
                new ProcessingReport.Model("SatelliteSR", "v1"),
                ProcessingReport.Timings.between(START, END));

        new ProcessingReportWriter().write(report, target);

        JSONObject written = new JSONObject(Files.readString(target));
        assertThat(written.getJSONObject("model").getString("name")).isEqualTo("SatelliteSR");
        assertThat(target.resolveSibling("processing_report.json.tmp")).doesNotExist();
    }
}
