package com.phillippitts.satupscale.service.raster;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to write a raster: driver, grid, band pixels and the metadata copied from
 * the source.
 *
 * @param driver GDAL-style driver name, {@code GTiff} or {@code JP2OpenJPEG}
 */
public record RasterWriteSpec(
        String driver,
        GridSignature grid,
        List<BandData> bands,
        List<BandInfo> bandInfo,
        Map<String, String> tags,
        Double nodata
) {

    public RasterWriteSpec {
        Objects.requireNonNull(driver, "driver");
        Objects.requireNonNull(grid, "grid");
        bands = List.copyOf(bands);
        bandInfo = List.copyOf(bandInfo);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        if (bands.size() != bandInfo.size()) {
            throw new IllegalArgumentException("band metadata count does not match band count");
        }
    }

    public RasterWriteSpec withDriver(String newDriver) {
        return new RasterWriteSpec(newDriver, grid, bands, bandInfo, tags, nodata);
    }
}
