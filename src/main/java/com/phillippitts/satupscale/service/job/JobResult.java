package com.phillippitts.satupscale.service.job;

/**
 * Outcome of a job that ran every unit without being cancelled.
 */
public record JobResult(String jobId, int completedUnits, int totalUnits, long durationMs) {
}
