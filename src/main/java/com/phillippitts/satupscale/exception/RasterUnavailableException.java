package com.phillippitts.satupscale.exception;

/**
 * Thrown when a metadata-preserving raster operation is requested but no geospatial raster
 * backend is configured.
 */
public class RasterUnavailableException extends SatUpscaleException {

    public static final String ERROR_CODE = "IO-010";

    public RasterUnavailableException(String message) {
        super(message + " (code " + ERROR_CODE + ")");
    }
}
