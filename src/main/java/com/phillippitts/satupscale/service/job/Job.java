package com.phillippitts.satupscale.service.job;

import java.util.Objects;

/**
 * Immutable description of a unit-of-work job: identity, unit count, the work function,
 * an optional description, the cancellation signal observed between units and an optional
 * hook invoked once when cancellation is observed.
 *
 * <p>Unit count is validated by {@link JobRunner#run}, not here, so an invalid job can still be
 * submitted and fail on the worker like any other job.
 */
public final class Job {

    private final String jobId;
    private final int totalUnits;
    private final UnitOfWork work;
    private final String description;
    private final CancellationSignal cancellation;
    private final Runnable onCancel;

    private Job(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId");
        this.totalUnits = builder.totalUnits;
        this.work = Objects.requireNonNull(builder.work, "work");
        this.description = builder.description;
        this.cancellation = builder.cancellation != null ? builder.cancellation : new CancellationToken();
        this.onCancel = builder.onCancel;
    }

    public static Builder builder(String jobId, int totalUnits, UnitOfWork work) {
        return new Builder(jobId, totalUnits, work);
    }

    public String jobId() {
        return jobId;
    }

    public int totalUnits() {
        return totalUnits;
    }

    public UnitOfWork work() {
        return work;
    }

    public String description() {
        return description;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    /** @return cancel hook, or null */
    public Runnable onCancel() {
        return onCancel;
    }

    @Override
    public String toString() {
        return "Job[" + jobId + ", units=" + totalUnits + "]";
    }

    public static final class Builder {
        private final String jobId;
        private final int totalUnits;
        private final UnitOfWork work;
        private String description;
        private CancellationSignal cancellation;
        private Runnable onCancel;

        private Builder(String jobId, int totalUnits, UnitOfWork work) {
            this.jobId = jobId;
            this.totalUnits = totalUnits;
            this.work = work;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder onCancel(Runnable onCancel) {
            this.onCancel = onCancel;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
