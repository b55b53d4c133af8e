package com.phillippitts.satupscale.service.raster;

/**
 * Affine pixel-to-world transform {@code x = a*col + b*row + c}, {@code y = d*col + e*row + f}.
 */
public record GeoTransform(double a, double b, double c, double d, double e, double f) {

    /**
     * Transform of the same extent sampled {@code scale} times more densely.
     */
    public GeoTransform scaled(int scale) {
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        return new GeoTransform(a / scale, b / scale, c, d / scale, e / scale, f);
    }
}
