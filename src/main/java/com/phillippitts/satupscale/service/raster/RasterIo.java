package com.phillippitts.satupscale.service.raster;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Geospatial raster backend used for metadata-preserving masters.
 *
 * <p>Implementations wrap a native raster library. The application ships only
 * {@link UnavailableRasterIo}; a deployment with a raster library registers its own bean.
 */
public interface RasterIo {

    /** @return false when no backend is installed and every call will fail */
    boolean isAvailable();

    RasterDataset open(Path path) throws IOException;

    void write(Path path, RasterWriteSpec spec) throws IOException;
}
