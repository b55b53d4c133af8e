package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.exception.JobCancelledException;
import com.phillippitts.satupscale.exception.RunCancelledException;
import com.phillippitts.satupscale.exception.UpscaleFailedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackChainTest {

    /** Records listener callbacks as "chain:strategy:Exception" strings. */
    private static final class RecordingListener implements FallbackChain.FallbackListener {
        final List<String> failed = new ArrayList<>();
        final List<String> exhausted = new ArrayList<>();

        @Override
        public void onStrategyFailed(String chain, String strategy, Exception failure) {
            failed.add(chain + ":" + strategy + ":" + failure.getClass().getSimpleName());
        }

        @Override
        public void onExhausted(String chain, Exception lastFailure) {
            exhausted.add(chain + ":" + lastFailure.getMessage());
        }
    }

    @Test
    void firstSuccessfulStrategyWinsAndLaterOnesDoNotRun() {
        List<String> attempted = new ArrayList<>();
        ProvenanceNotes notes = new ProvenanceNotes();
        FallbackChain<String> chain = FallbackChain.<String>named("master")
                .then("preferred", () -> {
                    attempted.add("preferred");
                    return "a";
                })
                .then("backup", () -> {
                    attempted.add("backup");
                    return "b";
                }, "used backup")
                .build();

        assertThat(chain.run(notes, null)).isEqualTo("a");
        assertThat(attempted).containsExactly("preferred");
        assertThat(notes.isEmpty()).isTrue();
    }

    @Test
    void fallbackRecordsNoteOfSucceedingStepAndNotifiesListener() {
        RecordingListener listener = new RecordingListener();
        ProvenanceNotes notes = new ProvenanceNotes();
        FallbackChain<String> chain = FallbackChain.<String>named("visual")
                .then("model", () -> {
                    throw new IOException("no runtime");
                }, "model note")
                .then("derive", () -> "derived", "derive note")
                .build();

        assertThat(chain.run(notes, listener)).isEqualTo("derived");
        assertThat(notes.snapshot()).containsExactly("derive note");
        assertThat(listener.failed).containsExactly("visual:model:IOException");
        assertThat(listener.exhausted).isEmpty();
    }

    @Test
    void exhaustedChainThrowsWithLastFailureAsCauseAndEarlierSuppressed() {
        RecordingListener listener = new RecordingListener();
        IOException first = new IOException("first");
        IllegalStateException last = new IllegalStateException("last");
        FallbackChain<String> chain = FallbackChain.<String>named("master")
                .then("one", () -> {
                    throw first;
                })
                .then("two", () -> {
                    throw last;
                })
                .build();

        assertThatThrownBy(() -> chain.run(new ProvenanceNotes(), listener))
                .isInstanceOf(UpscaleFailedException.class)
                .hasCause(last)
                .satisfies(e -> {
                    assertThat(e.getSuppressed()).containsExactly(first);
                    assertThat(((UpscaleFailedException) e).getChain()).isEqualTo("master");
                });
        assertThat(listener.failed).hasSize(2);
        assertThat(listener.exhausted).containsExactly("master:last");
    }

    @Test
    void cancellationIsNotTreatedAsStrategyFailure() {
        RecordingListener listener = new RecordingListener();
        List<String> attempted = new ArrayList<>();
        FallbackChain<String> runCancelled = FallbackChain.<String>named("master")
                .then("one", () -> {
                    throw new RunCancelledException("stop");
                })
                .then("two", () -> {
                    attempted.add("two");
                    return "x";
                })
                .build();
        FallbackChain<String> jobCancelled = FallbackChain.<String>named("master")
                .then("one", () -> {
                    throw new JobCancelledException("job", 0);
                })
                .build();

        assertThatThrownBy(() -> runCancelled.run(new ProvenanceNotes(), listener))
                .isInstanceOf(RunCancelledException.class);
        assertThatThrownBy(() -> jobCancelled.run(new ProvenanceNotes(), listener))
                .isInstanceOf(JobCancelledException.class);
        assertThat(attempted).isEmpty();
        assertThat(listener.failed).isEmpty();
    }

    @Test
    void emptyChainCannotBeBuilt() {
        assertThatThrownBy(() -> FallbackChain.named("empty").build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void exposesStrategyNamesInOrder() {
        FallbackChain<Integer> chain = FallbackChain.<Integer>named("c")
                .then("a", () -> 1)
                .then("b", () -> 2)
                .build();

        assertThat(chain.strategyNames()).containsExactly("a", "b");
        assertThat(chain.name()).isEqualTo("c");
    }
}
