package com.phillippitts.satupscale.exception;

/**
 * Base exception for all satupscale application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SatUpscaleException extends RuntimeException {

    public SatUpscaleException(String message) {
        super(message);
    }

    public SatUpscaleException(String message, Throwable cause) {
        super(message, cause);
    }

    public SatUpscaleException(Throwable cause) {
        super(cause);
    }
}
