package com.phillippitts.satupscale.exception;

/**
 * Thrown by the job runner when cancellation is observed between units of work.
 * Units already completed are reported; no {@code JobResult} is produced.
 */
public class JobCancelledException extends SatUpscaleException {

    private final String jobId;
    private final int completedUnits;

    public JobCancelledException(String jobId, int completedUnits) {
        super("Job cancelled: " + jobId + " (completed units: " + completedUnits + ")");
        this.jobId = jobId;
        this.completedUnits = completedUnits;
    }

    public String getJobId() {
        return jobId;
    }

    public int getCompletedUnits() {
        return completedUnits;
    }
}
