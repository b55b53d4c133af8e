package com.phillippitts.satupscale.exception;

/**
 * Thrown when the external super-resolution model cannot be run or produces no output.
 * This may occur due to a missing installation, a non-zero process exit, or a timeout.
 */
public class ModelInvocationException extends SatUpscaleException {

    public static final String ERROR_CODE = "MODEL-010";

    private final String modelName;

    public ModelInvocationException(String message) {
        super(message);
        this.modelName = "unknown";
    }

    public ModelInvocationException(String message, String modelName) {
        super(message + " (model: " + modelName + ")");
        this.modelName = modelName;
    }

    public ModelInvocationException(String message, String modelName, Throwable cause) {
        super(message + " (model: " + modelName + ")", cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
