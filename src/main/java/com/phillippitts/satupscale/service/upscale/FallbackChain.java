package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.exception.JobCancelledException;
import com.phillippitts.satupscale.exception.RunCancelledException;
import com.phillippitts.satupscale.exception.UpscaleFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered strategies tried until one succeeds, strongest first.
 *
 * <p>Each step may carry a provenance note that is recorded only when that step is the one that
 * succeeds. Every failed step is reported to the {@link FallbackListener}; when the last step
 * fails the chain throws {@link UpscaleFailedException} with the last failure as cause and the
 * earlier failures suppressed. Cancellation exceptions are never treated as strategy failures.
 *
 * @param <T> strategy result
 */
public final class FallbackChain<T> {

    private static final Logger LOG = LogManager.getLogger(FallbackChain.class);

    /** A single way of producing the result. */
    @FunctionalInterface
    public interface Strategy<T> {
        T attempt() throws Exception;
    }

    /** Observer of failed strategies. */
    public interface FallbackListener {

        void onStrategyFailed(String chain, String strategy, Exception failure);

        void onExhausted(String chain, Exception lastFailure);

        static FallbackListener none() {
            return new FallbackListener() {
                @Override
                public void onStrategyFailed(String chain, String strategy, Exception failure) {
                }

                @Override
                public void onExhausted(String chain, Exception lastFailure) {
                }
            };
        }
    }

    private record Step<T>(String name, Strategy<T> strategy, String note) {}

    private final String name;
    private final List<Step<T>> steps;

    private FallbackChain(String name, List<Step<T>> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public static <T> Builder<T> named(String name) {
        return new Builder<>(name);
    }

    public String name() {
        return name;
    }

    public List<String> strategyNames() {
        return steps.stream().map(Step::name).toList();
    }

    /**
     * Runs the strategies in order.
     *
     * @param notes receives the note of the step that succeeds, if it has one
     * @return the first successful result
     * @throws UpscaleFailedException if every strategy failed
     */
    public T run(ProvenanceNotes notes, FallbackListener listener) {
        Objects.requireNonNull(notes, "notes");
        FallbackListener observer = listener != null ? listener : FallbackListener.none();
        List<Exception> failures = new ArrayList<>();
        for (Step<T> step : steps) {
            try {
                T result = step.strategy().attempt();
                if (step.note() != null) {
                    notes.add(step.note());
                }
                if (!failures.isEmpty()) {
                    LOG.info("Chain '{}' succeeded with fallback '{}'", name, step.name());
                }
                return result;
            } catch (RunCancelledException | JobCancelledException e) {
                throw e;
            } catch (Exception e) {
                LOG.warn("Strategy '{}' of chain '{}' failed: {}", step.name(), name, e.toString());
                failures.add(e);
                observer.onStrategyFailed(name, step.name(), e);
            }
        }
        Exception last = failures.isEmpty()
                ? new IllegalStateException("no strategies configured")
                : failures.remove(failures.size() - 1);
        observer.onExhausted(name, last);
        UpscaleFailedException failed = new UpscaleFailedException(name, last);
        failures.forEach(failed::addSuppressed);
        throw failed;
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<T> then(String strategyName, Strategy<T> strategy) {
            return then(strategyName, strategy, null);
        }

        /**
         * @param note recorded when this step is the one that succeeds (may be null)
         */
        public Builder<T> then(String strategyName, Strategy<T> strategy, String note) {
            steps.add(new Step<>(Objects.requireNonNull(strategyName, "strategyName"),
                    Objects.requireNonNull(strategy, "strategy"), note));
            return this;
        }

        public FallbackChain<T> build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Fallback chain '" + name + "' has no strategies");
            }
            return new FallbackChain<>(name, steps);
        }
    }
}
