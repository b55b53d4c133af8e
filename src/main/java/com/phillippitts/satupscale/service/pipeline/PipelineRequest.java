package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.service.job.CancellationSignal;
import com.phillippitts.satupscale.service.job.JobProgressListener;
import com.phillippitts.satupscale.service.output.OutputTracker;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Inputs of one {@link JobPipeline#run} call. Built with {@link #builder}.
 */
public final class PipelineRequest {

    private final String jobId;
    private final int totalUnits;
    private final Path outputDir;
    private final TrackedUnitOfWork work;
    private final ProcessingReportConfig reportConfig;
    private final Clock reportClock;
    private final CancellationSignal cancellation;
    private final JobProgressListener onProgress;
    private final Runnable onCancel;
    private final OutputTracker tracker;

    private PipelineRequest(Builder b) {
        this.jobId = Objects.requireNonNull(b.jobId, "jobId");
        this.totalUnits = b.totalUnits;
        this.outputDir = Objects.requireNonNull(b.outputDir, "outputDir");
        this.work = Objects.requireNonNull(b.work, "work");
        this.reportConfig = b.reportConfig;
        this.reportClock = b.reportClock != null ? b.reportClock : Clock.systemUTC();
        this.cancellation = b.cancellation;
        this.onProgress = b.onProgress;
        this.onCancel = b.onCancel;
        this.tracker = b.tracker;
        if (tracker != null && !tracker.outputDir().equals(outputDir)) {
            throw new IllegalArgumentException("tracker must own the output directory " + outputDir);
        }
    }

    public static Builder builder(String jobId, int totalUnits, Path outputDir, TrackedUnitOfWork work) {
        return new Builder(jobId, totalUnits, outputDir, work);
    }

    public String jobId() {
        return jobId;
    }

    public int totalUnits() {
        return totalUnits;
    }

    public Path outputDir() {
        return outputDir;
    }

    public TrackedUnitOfWork work() {
        return work;
    }

    /** @return report configuration, or null when no report is wanted */
    public ProcessingReportConfig reportConfig() {
        return reportConfig;
    }

    public Clock reportClock() {
        return reportClock;
    }

    /** @return caller-supplied signal, or null for a fresh one */
    public CancellationSignal cancellation() {
        return cancellation;
    }

    public JobProgressListener onProgress() {
        return onProgress;
    }

    public Runnable onCancel() {
        return onCancel;
    }

    /** @return caller-owned tracker for the job's outputs, or null for one owned by the pipeline */
    public OutputTracker tracker() {
        return tracker;
    }

    public static final class Builder {
        private final String jobId;
        private final int totalUnits;
        private final Path outputDir;
        private final TrackedUnitOfWork work;
        private ProcessingReportConfig reportConfig;
        private Clock reportClock;
        private CancellationSignal cancellation;
        private JobProgressListener onProgress;
        private Runnable onCancel;
        private OutputTracker tracker;

        private Builder(String jobId, int totalUnits, Path outputDir, TrackedUnitOfWork work) {
            this.jobId = jobId;
            this.totalUnits = totalUnits;
            this.outputDir = outputDir;
            this.work = work;
        }

        public Builder report(ProcessingReportConfig reportConfig) {
            this.reportConfig = reportConfig;
            return this;
        }

        public Builder reportClock(Clock reportClock) {
            this.reportClock = reportClock;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder onProgress(JobProgressListener onProgress) {
            this.onProgress = onProgress;
            return this;
        }

        public Builder onCancel(Runnable onCancel) {
            this.onCancel = onCancel;
            return this;
        }

        public Builder tracker(OutputTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public PipelineRequest build() {
            return new PipelineRequest(this);
        }
    }
}
