package com.phillippitts.satupscale.service.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link CancellationSignal} backed by an {@link AtomicBoolean}.
 */
public final class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + cancelled.get() + "]";
    }
}
