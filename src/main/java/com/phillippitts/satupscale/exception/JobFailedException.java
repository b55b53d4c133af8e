package com.phillippitts.satupscale.exception;

/**
 * Wraps a checked exception raised by a unit of work. Unchecked exceptions propagate unwrapped.
 */
public class JobFailedException extends SatUpscaleException {

    public static final String ERROR_CODE = "JOB-001";

    private final String jobId;
    private final int unitIndex;

    public JobFailedException(String jobId, int unitIndex, Throwable cause) {
        super("Job " + jobId + " failed at unit " + unitIndex + ": " + cause.getMessage(), cause);
        this.jobId = jobId;
        this.unitIndex = unitIndex;
    }

    public String getJobId() {
        return jobId;
    }

    public int getUnitIndex() {
        return unitIndex;
    }
}
