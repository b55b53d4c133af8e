package com.phillippitts.satupscale.service.job;

/**
 * Cooperative cancel flag shared between the thread requesting a stop and the worker
 * observing it at safe points (between units of work).
 *
 * <p>Implementations must make {@link #cancel()} idempotent and callable from any thread;
 * once cancelled, {@link #isCancelled()} returns true forever.
 */
public interface CancellationSignal {

    /** Requests cancellation. Safe to call more than once and from any thread. */
    void cancel();

    /** @return true once {@link #cancel()} has been called */
    boolean isCancelled();
}
