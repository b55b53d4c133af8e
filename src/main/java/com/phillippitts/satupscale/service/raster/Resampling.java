package com.phillippitts.satupscale.service.raster;

/** Resampling kernel used when a band is read onto a different grid. */
public enum Resampling {
    /** Keeps original values; required for categorical bands. */
    NEAREST,
    BILINEAR
}
