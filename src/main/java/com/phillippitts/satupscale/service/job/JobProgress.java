package com.phillippitts.satupscale.service.job;

/**
 * Progress snapshot emitted after each completed unit.
 *
 * @param jobId job identity
 * @param completedUnits units finished so far (1..totalUnits)
 * @param totalUnits total units of the job
 * @param progress completedUnits / totalUnits, in [0, 1]
 * @param etaSeconds average unit duration times remaining units; null when unknown
 */
public record JobProgress(
        String jobId,
        int completedUnits,
        int totalUnits,
        double progress,
        Double etaSeconds
) {
}
