package com.phillippitts.satupscale.service.model;

import com.phillippitts.satupscale.exception.ModelInvocationException;

/**
 * Runs an installed super-resolution model against one input file.
 */
public interface ModelInvoker {

    /**
     * Runs the model and returns once the output file has been written.
     *
     * @throws ModelInvocationException if the model is not installed, fails, times out or writes
     *         no output
     */
    void invoke(ModelInvocation invocation);
}
