package com.phillippitts.satupscale.service.job;

/**
 * One indivisible step of a {@link Job}, identified by its zero-based index.
 */
@FunctionalInterface
public interface UnitOfWork {

    void run(int unitIndex) throws Exception;
}
