package com.phillippitts.satupscale.exception;

/**
 * Raised when an operator cancels an in-flight upscale batch.
 *
 * <p>Carries no partial results: by the time a caller sees it, every output the batch had
 * written has already been removed from disk.
 */
public class RunCancelledException extends SatUpscaleException {

    public RunCancelledException(String message) {
        super(message);
    }
}
