package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.service.job.Job;
import com.phillippitts.satupscale.service.job.JobResult;
import com.phillippitts.satupscale.service.job.JobRunner;
import com.phillippitts.satupscale.service.output.OutputTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs a job whose units write into a shared {@link OutputTracker} and, on success, exports a
 * processing report.
 *
 * <p>Cancellation discards every tracked output before the caller's cancel hook runs; no report
 * is written for a cancelled or failed job. The report path is claimed in the tracker too, so a
 * caller that owns the tracker can still discard a finished job's outputs.
 */
public final class JobPipeline {

    private static final Logger LOG = LogManager.getLogger(JobPipeline.class);

    private final JobRunner runner;
    private final ModelVersionResolver versions;
    private final ProcessingReportWriter reportWriter;

    public JobPipeline(JobRunner runner, ModelVersionResolver versions, ProcessingReportWriter reportWriter) {
        this.runner = runner != null ? runner : new JobRunner();
        this.versions = Objects.requireNonNull(versions, "versions");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
    }

    /**
     * @throws com.phillippitts.satupscale.exception.JobCancelledException if cancelled; outputs are gone
     * @throws UncheckedIOException if the report cannot be written
     */
    public JobResult run(PipelineRequest request) {
        OutputTracker tracker = request.tracker() != null ? request.tracker() : new OutputTracker(request.outputDir());
        ProcessingReportConfig reportConfig = request.reportConfig();
        Instant startedAt = reportConfig != null ? request.reportClock().instant() : null;

        Runnable callerHook = request.onCancel();
        Job.Builder job = Job.builder(request.jobId(), request.totalUnits(),
                        unitIndex -> request.work().run(unitIndex, tracker))
                .onCancel(() -> {
                    tracker.discard();
                    if (callerHook != null) {
                        callerHook.run();
                    }
                });
        if (request.cancellation() != null) {
            job.cancellation(request.cancellation());
        }

        JobResult result = runner.run(job.build(), request.onProgress());

        if (reportConfig != null) {
            Instant completedAt = request.reportClock().instant();
            ProcessingReport report = ProcessingReport.build(reportConfig,
                    ProcessingReport.Timings.between(startedAt, completedAt), versions);
            try {
                reportWriter.write(report, tracker.outputPath(reportConfig.reportPath()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write processing report " + reportConfig.reportPath(), e);
            }
            LOG.debug("Job {} report exported", request.jobId());
        }
        return result;
    }
}
