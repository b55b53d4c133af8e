package com.phillippitts.satupscale.service.raster;

import java.util.Objects;

/**
 * Georeferenced pixel grid: coordinate reference system, transform and size.
 *
 * @param crs CRS identifier such as {@code EPSG:32633}, or null when the raster has none
 */
public record GridSignature(String crs, GeoTransform transform, int width, int height) {

    public GridSignature {
        Objects.requireNonNull(transform, "transform");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid dimensions must be positive");
        }
    }

    /** Same CRS and extent, {@code scale} times as many pixels on each axis. */
    public GridSignature upscaled(int scale) {
        return new GridSignature(crs, transform.scaled(scale), width * scale, height * scale);
    }

    public boolean matches(GridSignature other) {
        return other != null
                && Objects.equals(crs, other.crs)
                && transform.equals(other.transform)
                && width == other.width
                && height == other.height;
    }
}
