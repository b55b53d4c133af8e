package com.phillippitts.satupscale.service.job;

import com.phillippitts.satupscale.exception.JobCancelledException;
import com.phillippitts.satupscale.exception.JobFailedException;
import com.phillippitts.satupscale.exception.RunCancelledException;
import org.apache.logging.log4j.Level;

import static com.phillippitts.satupscale.service.job.JobEventLogger.fields;

/**
 * Executes the units of one {@link Job} sequentially on the calling thread.
 *
 * <p>After every unit the runner computes progress and an ETA
 * ({@code average unit duration x remaining units}), notifies the progress listener and emits a
 * {@code job_progress} event. Cancellation is cooperative: the job's signal is checked before the
 * first unit, before each unit and after each unit. On the first observation the job's cancel hook
 * runs, a {@code job_cancelled} event is logged and {@link JobCancelledException} is thrown.
 *
 * <p>A unit that throws is not retried. Unchecked exceptions propagate unchanged; checked exceptions
 * are wrapped in {@link JobFailedException}. Either way a {@code job_failed} event is logged and no
 * {@link JobResult} is produced.
 *
 * <p><b>Thread Safety:</b> stateless apart from its collaborators; one runner may serve many
 * sequential {@link #run} calls.
 */
public final class JobRunner {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final JobEventLogger events;
    private final MonotonicClock clock;

    public JobRunner() {
        this(null, null);
    }

    /**
     * @param events structured event sink, or null for no-op logging
     * @param clock monotonic time source, or null for {@link System#nanoTime()}
     */
    public JobRunner(JobEventLogger events, MonotonicClock clock) {
        this.events = events != null ? events : JobEventLogger.noop();
        this.clock = clock != null ? clock : MonotonicClock.system();
    }

    public JobResult run(Job job) {
        return run(job, null);
    }

    /**
     * Runs every unit of {@code job} in order.
     *
     * @param job job to execute
     * @param onProgress listener for per-unit progress (may be null)
     * @return result of the fully completed job
     * @throws IllegalArgumentException if the job has no units
     * @throws JobCancelledException if cancellation was observed between units
     */
    public JobResult run(Job job, JobProgressListener onProgress) {
        if (job.totalUnits() <= 0) {
            throw new IllegalArgumentException("totalUnits must be positive");
        }
        JobProgressListener listener = onProgress != null ? onProgress : JobProgressListener.none();
        CancellationSignal signal = job.cancellation();
        int total = job.totalUnits();

        long startNanos = clock.nanoTime();
        long unitNanosTotal = 0L;
        int completed = 0;

        events.logEvent(Level.INFO, "job_start", "Job started", fields(
                "job_id", job.jobId(),
                "total_units", total,
                "description", job.description()));

        for (int unitIndex = 0; unitIndex < total; unitIndex++) {
            if (signal.isCancelled()) {
                throw cancelled(job, completed, startNanos);
            }
            long unitStart = clock.nanoTime();
            runUnit(job, unitIndex);
            long unitEnd = clock.nanoTime();

            unitNanosTotal += unitEnd - unitStart;
            completed++;

            if (signal.isCancelled()) {
                throw cancelled(job, completed, startNanos);
            }

            double averageSeconds = unitNanosTotal / NANOS_PER_SECOND / completed;
            double etaSeconds = averageSeconds * (total - completed);
            JobProgress progress = new JobProgress(
                    job.jobId(), completed, total, (double) completed / total, etaSeconds);
            listener.onProgress(progress);

            events.logEvent(Level.INFO, "job_progress", "Job progress update", fields(
                    "job_id", job.jobId(),
                    "completed_units", completed,
                    "total_units", total,
                    "progress", progress.progress(),
                    "eta_seconds", etaSeconds));
        }

        long durationMs = elapsedMillis(startNanos);
        events.logEvent(Level.INFO, "job_complete", "Job completed", fields(
                "job_id", job.jobId(),
                "completed_units", completed,
                "total_units", total,
                "duration_ms", durationMs));
        return new JobResult(job.jobId(), completed, total, durationMs);
    }

    private void runUnit(Job job, int unitIndex) {
        try {
            job.work().run(unitIndex);
        } catch (JobCancelledException | RunCancelledException e) {
            // Cancellation raised from inside a unit is not a failure
            throw e;
        } catch (RuntimeException e) {
            logFailure(job, e);
            throw e;
        } catch (Exception e) {
            logFailure(job, e);
            throw new JobFailedException(job.jobId(), unitIndex, e);
        }
    }

    private void logFailure(Job job, Exception e) {
        events.logEvent(Level.ERROR, "job_failed", "Job failed", fields(
                "job_id", job.jobId(),
                "error", String.valueOf(e.getMessage()),
                "error_code", JobFailedException.ERROR_CODE));
    }

    private JobCancelledException cancelled(Job job, int completed, long startNanos) {
        Runnable hook = job.onCancel();
        if (hook != null) {
            hook.run();
        }
        events.logEvent(Level.INFO, "job_cancelled", "Job cancelled", fields(
                "job_id", job.jobId(),
                "completed_units", completed,
                "total_units", job.totalUnits(),
                "duration_ms", elapsedMillis(startNanos)));
        return new JobCancelledException(job.jobId(), completed);
    }

    private long elapsedMillis(long startNanos) {
        return (clock.nanoTime() - startNanos) / 1_000_000L;
    }
}
