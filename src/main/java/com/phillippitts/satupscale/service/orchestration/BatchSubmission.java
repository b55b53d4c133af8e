package com.phillippitts.satupscale.service.orchestration;

import com.phillippitts.satupscale.service.pipeline.ProcessingReportConfig;
import com.phillippitts.satupscale.service.upscale.UpscaleRequest;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A batch of upscale requests to run as one job.
 *
 * @param report processing report to export on success, or null for none
 */
public record BatchSubmission(List<UpscaleRequest> requests, Path outputDir, ProcessingReportConfig report) {

    public BatchSubmission {
        requests = List.copyOf(requests);
        Objects.requireNonNull(outputDir, "outputDir");
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("at least one input is required");
        }
    }
}
