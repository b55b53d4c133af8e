package com.phillippitts.satupscale.service.pipeline;

import com.phillippitts.satupscale.service.output.OutputTracker;

/**
 * Unit of work that claims its outputs in the pipeline's {@link OutputTracker}.
 */
@FunctionalInterface
public interface TrackedUnitOfWork {

    void run(int unitIndex, OutputTracker tracker) throws Exception;
}
