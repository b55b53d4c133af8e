package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.output.OutputTracker;
import com.phillippitts.satupscale.service.raster.BandData;
import com.phillippitts.satupscale.service.raster.BandInfo;
import com.phillippitts.satupscale.service.raster.GridSignature;
import com.phillippitts.satupscale.service.raster.RasterDataset;
import com.phillippitts.satupscale.service.raster.RasterIo;
import com.phillippitts.satupscale.service.raster.RasterWriteSpec;
import com.phillippitts.satupscale.service.raster.Resampling;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes a metadata-preserving master: every band resampled onto the upscaled grid, descriptions
 * and tags copied through.
 *
 * <p>The output grid is the source grid with {@code scale} times the pixels. When the request
 * names a target grid that differs from the source, bands are warped onto the upscaled target
 * instead. If the requested driver cannot write, the master is rewritten as GeoTIFF next to the
 * requested path and a note is recorded.
 */
public final class GeospatialMasterWriter {

    private static final Logger LOG = LogManager.getLogger(GeospatialMasterWriter.class);

    static final String GEOTIFF_FALLBACK_NOTE =
            "Requested geospatial format unavailable; wrote GeoTIFF master instead.";

    private final RasterIo rasterIo;

    public GeospatialMasterWriter(RasterIo rasterIo) {
        this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    }

    /**
     * @param requestedPath master path for the requested format, already claimed
     * @return the path actually written
     * @throws IOException if the source cannot be read or neither driver can write
     */
    public Path write(UpscaleRequest request, Path requestedPath, OutputTracker tracker,
                      ProvenanceNotes notes) throws IOException {
        int scale = request.scale();
        RasterWriteSpec spec;
        try (RasterDataset src = rasterIo.open(request.inputPath())) {
            GridSignature source = src.grid();
            GridSignature target = request.reprojectTo();
            boolean reproject = target != null && !source.matches(target);
            GridSignature output = reproject ? target.upscaled(scale) : source.upscaled(scale);
            if (output.crs() == null && source.crs() != null) {
                output = new GridSignature(source.crs(), output.transform(), output.width(), output.height());
            }

            List<BandData> bands = new ArrayList<>(src.bandCount());
            List<BandInfo> infos = new ArrayList<>(src.bandCount());
            for (int band = 1; band <= src.bandCount(); band++) {
                BandInfo info = src.band(band);
                Resampling method = BandResamplingPolicy.forBand(info);
                BandData data = reproject
                        ? src.reproject(band, output, method)
                        : src.read(band, output.width(), output.height(), method);
                bands.add(data);
                infos.add(info);
            }
            LOG.debug("Resampled {} band(s) of {} onto {}x{} (reproject={})",
                    bands.size(), request.inputPath().getFileName(), output.width(), output.height(), reproject);
            spec = new RasterWriteSpec(OutputFormats.driverFor(request.outputPlan().masterFormat()),
                    output, bands, infos, src.tags(), src.nodata());
        }

        try {
            rasterIo.write(requestedPath, spec);
            return requestedPath;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Driver {} failed for {}: {}; retrying as GeoTIFF", spec.driver(), requestedPath.getFileName(),
                    e.toString());
            Files.deleteIfExists(requestedPath);
        }
        Path fallback = tracker.outputPath(OutputNaming.withExtension(requestedPath, ".tif"));
        try {
            rasterIo.write(fallback, spec.withDriver(OutputFormats.GTIFF_DRIVER));
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(fallback);
            throw e;
        }
        notes.add(GEOTIFF_FALLBACK_NOTE);
        return fallback;
    }
}
