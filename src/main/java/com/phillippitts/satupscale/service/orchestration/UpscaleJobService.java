package com.phillippitts.satupscale.service.orchestration;

import com.phillippitts.satupscale.exception.JobCancelledException;
import com.phillippitts.satupscale.exception.RunCancelledException;
import com.phillippitts.satupscale.service.job.CancellationToken;
import com.phillippitts.satupscale.service.job.Job;
import com.phillippitts.satupscale.service.job.JobQueue;
import com.phillippitts.satupscale.service.job.JobResult;
import com.phillippitts.satupscale.service.metrics.JobMetrics;
import com.phillippitts.satupscale.service.output.OutputTracker;
import com.phillippitts.satupscale.service.pipeline.JobPipeline;
import com.phillippitts.satupscale.service.pipeline.PipelineRequest;
import com.phillippitts.satupscale.service.upscale.UpscaleArtifact;
import com.phillippitts.satupscale.service.upscale.UpscaleBatchService;
import com.phillippitts.satupscale.service.upscale.UpscaleRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Submits upscale batches to the sequential {@link JobQueue} and tracks their state.
 *
 * <p>Each batch becomes one queued job. Without a processing report the job drives
 * {@link UpscaleBatchService#runBatch}; with one it runs through {@link JobPipeline}, one unit per
 * request, so the report is exported only after every request succeeded. Either way every output
 * is claimed in one tracker per job, and the queued job's cancel hook discards it, so a cancelled
 * batch leaves no outputs behind even when cancellation lands after the last request.
 */
@Service
public class UpscaleJobService {

    private static final Logger LOG = LogManager.getLogger(UpscaleJobService.class);

    private final JobQueue queue;
    private final UpscaleBatchService batchService;
    private final JobPipeline pipeline;
    private final JobRegistry registry;
    private final JobMetrics metrics;
    private final Clock clock;

    public UpscaleJobService(JobQueue queue, UpscaleBatchService batchService, JobPipeline pipeline,
                             JobRegistry registry, JobMetrics metrics, Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.batchService = Objects.requireNonNull(batchService, "batchService");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Queues a batch and returns immediately.
     *
     * @throws IllegalArgumentException if a report is requested without a model name
     * @throws IllegalStateException if the queue has been shut down
     */
    public JobRecord submit(BatchSubmission submission) {
        Objects.requireNonNull(submission, "submission");
        if (submission.report() != null
                && (submission.report().modelName() == null || submission.report().modelName().isBlank())) {
            throw new IllegalArgumentException("A processing report requires a model name");
        }
        String jobId = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken();
        JobRecord record = new JobRecord(jobId, submission.requests().size(), clock.instant(), token);
        registry.register(record);

        OutputTracker tracker = new OutputTracker(submission.outputDir());
        Job job = Job.builder(jobId, 1, unitIndex -> runSubmission(record, submission, tracker))
                .description("Upscale " + submission.requests().size() + " input(s) into " + submission.outputDir())
                .cancellation(token)
                .onCancel(tracker::discard)
                .build();

        long startNanos = System.nanoTime();
        CompletableFuture<JobResult> future = queue.submit(job);
        record.attach(future);
        future.whenComplete((result, failure) -> onFinished(record, failure, startNanos));
        LOG.info("Submitted job {} with {} input(s)", jobId, submission.requests().size());
        return record;
    }

    /**
     * @throws com.phillippitts.satupscale.exception.JobNotFoundException for an unknown id
     */
    public JobRecord get(String jobId) {
        return registry.require(jobId);
    }

    /**
     * Requests cancellation. A queued job never starts; a running job stops at the next request
     * boundary and its outputs are removed before the job reports {@link JobStatus#CANCELLED}.
     *
     * @throws IllegalStateException if the job already finished
     * @throws com.phillippitts.satupscale.exception.JobNotFoundException for an unknown id
     */
    public JobRecord cancel(String jobId) {
        JobRecord record = registry.require(jobId);
        if (record.status().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " already " + record.status());
        }
        record.cancellation().cancel();
        CompletableFuture<JobResult> future = record.future();
        if (future != null) {
            queue.cancel(future);
        }
        return record;
    }

    private void runSubmission(JobRecord record, BatchSubmission submission, OutputTracker tracker) {
        record.markRunning();
        List<UpscaleRequest> requests = submission.requests();
        CancellationToken token = record.cancellation();
        if (submission.report() == null) {
            List<UpscaleArtifact> artifacts = batchService.runBatch(requests, tracker,
                    (completed, total, master) -> record.progress(completed, null), token::isCancelled);
            record.replaceArtifacts(artifacts);
            return;
        }
        PipelineRequest request = PipelineRequest.builder(record.jobId(), requests.size(), submission.outputDir(),
                        (unitIndex, unitTracker) -> record.addArtifact(
                                batchService.runRequest(requests.get(unitIndex), unitTracker)))
                .report(submission.report())
                .tracker(tracker)
                .cancellation(token)
                .onProgress(progress -> record.progress(progress.completedUnits(), progress.etaSeconds()))
                .build();
        pipeline.run(request);
    }

    private void onFinished(JobRecord record, Throwable failure, long startNanos) {
        Throwable cause = unwrap(failure);
        JobStatus status;
        String outcome;
        if (cause == null) {
            status = JobStatus.COMPLETED;
            outcome = JobMetrics.OUTCOME_COMPLETED;
        } else if (isCancellation(cause)) {
            status = JobStatus.CANCELLED;
            outcome = JobMetrics.OUTCOME_CANCELLED;
        } else {
            status = JobStatus.FAILED;
            outcome = JobMetrics.OUTCOME_FAILED;
        }
        String error = status == JobStatus.FAILED ? String.valueOf(cause.getMessage()) : null;
        if (record.finish(status, error, clock.instant())) {
            metrics.recordJob(outcome, System.nanoTime() - startNanos);
            if (status == JobStatus.FAILED) {
                LOG.warn("Job {} failed: {}", record.jobId(), cause.toString());
            } else {
                LOG.info("Job {} {}", record.jobId(), status.name().toLowerCase(Locale.ROOT));
            }
        }
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException
                || t instanceof JobCancelledException
                || t instanceof RunCancelledException;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
