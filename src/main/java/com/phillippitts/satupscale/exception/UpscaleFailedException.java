package com.phillippitts.satupscale.exception;

/**
 * Thrown when every strategy of a fallback chain failed. The last failure is the cause;
 * failures of stronger strategies are attached as suppressed exceptions.
 */
public class UpscaleFailedException extends SatUpscaleException {

    private final String chain;

    public UpscaleFailedException(String chain, Throwable lastFailure) {
        super("All strategies failed for " + chain + ": " + lastFailure.getMessage(), lastFailure);
        this.chain = chain;
    }

    public String getChain() {
        return chain;
    }
}
