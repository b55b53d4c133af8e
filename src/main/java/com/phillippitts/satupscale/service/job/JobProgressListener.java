package com.phillippitts.satupscale.service.job;

/** Receives one {@link JobProgress} per completed unit, in completion order. */
@FunctionalInterface
public interface JobProgressListener {

    void onProgress(JobProgress progress);

    static JobProgressListener none() {
        return progress -> { };
    }
}
