package com.phillippitts.satupscale.service.job;

/**
 * Monotonic time source in nanoseconds. Injected into the runner so tests can drive
 * unit durations deterministically.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nanoTime();

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
