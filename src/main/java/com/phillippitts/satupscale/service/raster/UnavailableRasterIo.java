package com.phillippitts.satupscale.service.raster;

import com.phillippitts.satupscale.exception.RasterUnavailableException;

import java.nio.file.Path;

/**
 * Placeholder backend used when no raster library is configured. Every operation raises
 * {@link RasterUnavailableException} so geospatial chains fall back to visual outputs.
 */
public final class UnavailableRasterIo implements RasterIo {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public RasterDataset open(Path path) {
        throw new RasterUnavailableException("No geospatial raster backend available to read " + path.getFileName());
    }

    @Override
    public void write(Path path, RasterWriteSpec spec) {
        throw new RasterUnavailableException("No geospatial raster backend available to write " + path.getFileName());
    }
}
