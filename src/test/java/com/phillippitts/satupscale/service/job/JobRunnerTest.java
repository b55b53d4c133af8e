package com.phillippitts.satupscale.service.job;

import com.phillippitts.satupscale.exception.JobCancelledException;
import com.phillippitts.satupscale.exception.JobFailedException;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JobRunnerTest {

    @Test
    void runsUnitsInOrderAndReportsEtaFromAverageUnitDuration() {
        // start, then (unitStart, unitEnd) pairs of 1s, 1s, 2s, then completion reading
        FakeMonotonicClock clock = FakeMonotonicClock.seconds(0, 0, 1, 1, 2, 2, 4, 4);
        RecordingEventLogger events = new RecordingEventLogger();
        JobRunner runner = new JobRunner(events, clock);
        List<Integer> order = new ArrayList<>();
        List<JobProgress> updates = new ArrayList<>();

        JobResult result = runner.run(Job.builder("job-1", 3, order::add).build(), updates::add);

        assertThat(order).containsExactly(0, 1, 2);
        assertThat(updates).extracting(JobProgress::completedUnits).containsExactly(1, 2, 3);
        assertThat(updates.get(0).etaSeconds()).isCloseTo(2.0, within(1e-9));
        assertThat(updates.get(1).etaSeconds()).isCloseTo(1.0, within(1e-9));
        assertThat(updates.get(2).etaSeconds()).isCloseTo(0.0, within(1e-9));
        assertThat(updates.get(2).progress()).isEqualTo(1.0);
        assertThat(result.completedUnits()).isEqualTo(3);
        assertThat(result.durationMs()).isEqualTo(4000L);
        assertThat(events.eventNames())
                .containsExactly("job_start", "job_progress", "job_progress", "job_progress", "job_complete");
    }

    @Test
    void rejectsJobWithoutUnits() {
        JobRunner runner = new JobRunner();

        assertThatThrownBy(() -> runner.run(Job.builder("empty", 0, i -> { }).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("totalUnits");
    }

    @Test
    void cancellationBeforeStartRunsNoUnitsAndInvokesHookOnce() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger hookCalls = new AtomicInteger();
        AtomicInteger unitCalls = new AtomicInteger();
        Job job = Job.builder("cancelled", 2, i -> unitCalls.incrementAndGet())
                .cancellation(token)
                .onCancel(hookCalls::incrementAndGet)
                .build();

        assertThatThrownBy(() -> new JobRunner().run(job))
                .isInstanceOf(JobCancelledException.class)
                .satisfies(e -> assertThat(((JobCancelledException) e).getCompletedUnits()).isZero());
        assertThat(unitCalls).hasValue(0);
        assertThat(hookCalls).hasValue(1);
    }

    @Test
    void cancellationDuringUnitStopsAfterThatUnitWithoutProgressUpdate() {
        CancellationToken token = new CancellationToken();
        RecordingEventLogger events = new RecordingEventLogger();
        List<JobProgress> updates = new ArrayList<>();
        Job job = Job.builder("mid", 3, i -> {
            if (i == 1) {
                token.cancel();
            }
        }).cancellation(token).build();

        assertThatThrownBy(() -> new JobRunner(events, null).run(job, updates::add))
                .isInstanceOf(JobCancelledException.class)
                .satisfies(e -> assertThat(((JobCancelledException) e).getCompletedUnits()).isEqualTo(2));
        assertThat(updates).hasSize(1);
        assertThat(events.eventNames()).contains("job_cancelled").doesNotContain("job_complete", "job_failed");
    }

    @Test
    void uncheckedFailurePropagatesUnchangedAndIsLogged() {
        RecordingEventLogger events = new RecordingEventLogger();
        IllegalStateException boom = new IllegalStateException("boom");
        Job job = Job.builder("fails", 2, i -> {
            throw boom;
        }).build();

        assertThatThrownBy(() -> new JobRunner(events, null).run(job)).isSameAs(boom);
        RecordingEventLogger.Entry failed = events.first("job_failed");
        assertThat(failed.level()).isEqualTo(Level.ERROR);
        assertThat(failed.fields()).containsEntry("error", "boom");
    }

    @Test
    void checkedFailureIsWrappedWithUnitIndex() {
        Job job = Job.builder("io", 3, i -> {
            if (i == 2) {
                throw new IOException("disk full");
            }
        }).build();

        assertThatThrownBy(() -> new JobRunner().run(job))
                .isInstanceOf(JobFailedException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("disk full")
                .satisfies(e -> assertThat(((JobFailedException) e).getUnitIndex()).isEqualTo(2));
    }

    @Test
    void cancellationRaisedInsideUnitIsNotLoggedAsFailure() {
        RecordingEventLogger events = new RecordingEventLogger();
        Job job = Job.builder("inner", 1, i -> {
            throw new JobCancelledException("inner", 0);
        }).build();

        assertThatThrownBy(() -> new JobRunner(events, null).run(job)).isInstanceOf(JobCancelledException.class);
        assertThat(events.eventNames()).doesNotContain("job_failed");
    }
}
