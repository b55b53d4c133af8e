package com.phillippitts.satupscale.service.raster;

import java.io.IOException;
import java.util.Map;

/**
 * An open raster. Band numbers are one-based.
 */
public interface RasterDataset extends AutoCloseable {

    int bandCount();

    GridSignature grid();

    BandInfo band(int bandNumber);

    /** Dataset-level tags. */
    Map<String, String> tags();

    /** @return nodata value, or null when undefined */
    Double nodata();

    /**
     * Reads a band resampled onto a {@code width x height} grid covering the same extent.
     */
    BandData read(int bandNumber, int width, int height, Resampling resampling) throws IOException;

    /**
     * Warps a band onto {@code target}, honouring the dataset's nodata value.
     */
    BandData reproject(int bandNumber, GridSignature target, Resampling resampling) throws IOException;

    @Override
    void close() throws IOException;
}
