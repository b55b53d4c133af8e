package com.phillippitts.satupscale.exception;

import java.nio.file.Path;

/**
 * Thrown when an input imagery file selected for upscaling does not exist or is not a regular file.
 */
public class InputNotFoundException extends SatUpscaleException {

    public static final String ERROR_CODE = "IO-001";

    private final transient Path inputPath;

    public InputNotFoundException(Path inputPath) {
        super("Input file not found: " + inputPath + " (code " + ERROR_CODE + ")");
        this.inputPath = inputPath;
    }

    public Path getInputPath() {
        return inputPath;
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }
}
