package com.phillippitts.satupscale.exception;

/**
 * Thrown when a job id does not match any submitted upscale job.
 */
public class JobNotFoundException extends SatUpscaleException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Unknown job: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
