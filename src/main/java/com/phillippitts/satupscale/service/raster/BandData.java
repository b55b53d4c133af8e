package com.phillippitts.satupscale.service.raster;

/**
 * Pixel values of one band, row-major.
 */
public record BandData(int width, int height, float[] values) {

    public BandData {
        if (values.length != (long) width * height) {
            throw new IllegalArgumentException(
                    "expected " + ((long) width * height) + " values, got " + values.length);
        }
    }
}
