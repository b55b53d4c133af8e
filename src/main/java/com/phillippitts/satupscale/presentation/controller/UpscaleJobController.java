package com.phillippitts.satupscale.presentation.controller;

import com.phillippitts.satupscale.config.properties.UpscaleProperties;
import com.phillippitts.satupscale.exception.InputNotFoundException;
import com.phillippitts.satupscale.service.orchestration.BatchSubmission;
import com.phillippitts.satupscale.service.orchestration.JobRecord;
import com.phillippitts.satupscale.service.orchestration.UpscaleJobService;
import com.phillippitts.satupscale.service.pipeline.ProcessingReportConfig;
import com.phillippitts.satupscale.service.upscale.BandHandling;
import com.phillippitts.satupscale.service.upscale.ExportSettings;
import com.phillippitts.satupscale.service.upscale.InputExpander;
import com.phillippitts.satupscale.service.upscale.OutputPlan;
import com.phillippitts.satupscale.service.upscale.UpscaleRequest;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * REST surface for submitting, inspecting and cancelling upscale jobs.
 */
@RestController
@RequestMapping("/api/jobs")
class UpscaleJobController {

    private static final Logger LOG = LogManager.getLogger(UpscaleJobController.class);

    static final String REPORT_FILE = "processing_report.json";

    private final UpscaleJobService jobService;
    private final UpscaleProperties props;

    UpscaleJobController(UpscaleJobService jobService, UpscaleProperties props) {
        this.jobService = jobService;
        this.props = props;
    }

    @PostMapping
    ResponseEntity<JobView> submit(@Valid @RequestBody UpscaleJobRequest body) {
        List<Path> selections = body.inputs().stream().map(Path::of).toList();
        for (Path selection : selections) {
            if (!Files.exists(selection)) {
                throw new InputNotFoundException(selection);
            }
        }
        List<Path> inputs = InputExpander.expand(selections);
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("No supported imagery found in the selected inputs");
        }
        BandHandling bandHandling = body.bandHandling() == null
                ? BandHandling.RGB_ONLY
                : BandHandling.fromLabel(body.bandHandling());
        OutputPlan plan = new OutputPlan(body.masterFormat(), body.visualFormat(), List.of());
        List<UpscaleRequest> requests = inputs.stream()
                .map(input -> UpscaleRequest.builder(input, plan, body.scale())
                        .bandHandling(bandHandling)
                        .model(body.modelName(), body.modelVersion())
                        .outputTag(body.outputTag())
                        .tiling(body.tiling())
                        .precision(body.precision())
                        .compute(body.compute())
                        .build())
                .toList();
        Path outputDir = Path.of(body.outputDir() == null || body.outputDir().isBlank()
                ? props.defaultOutputDir()
                : body.outputDir());

        ProcessingReportConfig report = null;
        if (body.report()) {
            report = ProcessingReportConfig.builder(
                            new ExportSettings(bandHandling, body.masterFormat()),
                            body.modelName(),
                            outputDir.resolve(REPORT_FILE))
                    .scale(body.scale())
                    .tiling(body.tiling())
                    .precision(body.precision())
                    .compute(body.compute())
                    .modelVersion(body.modelVersion())
                    .build();
        }

        JobRecord record = jobService.submit(new BatchSubmission(requests, outputDir, report));
        LOG.info("Accepted job {} ({} input(s))", record.jobId(), requests.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobView.of(record));
    }

    @GetMapping("/{jobId}")
    ResponseEntity<JobView> get(@PathVariable String jobId) {
        return ResponseEntity.ok(JobView.of(jobService.get(jobId)));
    }

    @PostMapping("/{jobId}/cancel")
    ResponseEntity<JobView> cancel(@PathVariable String jobId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobView.of(jobService.cancel(jobId)));
    }
}
