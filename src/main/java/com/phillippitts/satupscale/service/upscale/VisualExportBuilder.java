package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.image.ImageCodec;
import com.phillippitts.satupscale.service.image.PixelBands;
import com.phillippitts.satupscale.service.image.RgbRendering;
import com.phillippitts.satupscale.service.raster.BandData;
import com.phillippitts.satupscale.service.raster.RasterDataset;
import com.phillippitts.satupscale.service.raster.RasterIo;
import com.phillippitts.satupscale.service.raster.Resampling;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives an 8-bit RGB display image from a finished master.
 *
 * <p>The master is read back through the raster backend when one is available, otherwise through
 * the image codec. Three bands are picked by the request's mapping (or the band-count default),
 * stretched and saved. If the master cannot be read at all, the original input is resized as RGB.
 */
public final class VisualExportBuilder {

    private static final Logger LOG = LogManager.getLogger(VisualExportBuilder.class);

    private final RasterIo rasterIo;
    private final ImageCodec codec;
    private final VisualResizer resizer;

    public VisualExportBuilder(RasterIo rasterIo, ImageCodec codec, VisualResizer resizer) {
        this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.resizer = Objects.requireNonNull(resizer, "resizer");
    }

    public void build(UpscaleRequest request, Path masterPath, Path visualPath) throws IOException {
        PixelBands rgb = readMaster(request.rgbMapping(), masterPath);
        if (rgb == null) {
            resizer.resize(request.inputPath(), visualPath, request.scale(), BandHandling.RGB_ONLY,
                    request.rgbMapping());
            return;
        }
        codec.write(RgbRendering.stretchToRgb(rgb), visualPath);
    }

    private PixelBands readMaster(RgbBandMapping requested, Path masterPath) {
        if (rasterIo.isAvailable()) {
            try (RasterDataset master = rasterIo.open(masterPath)) {
                int count = master.bandCount();
                RgbBandMapping mapping = requested != null ? requested : RgbBandMapping.defaultFor(count);
                int width = master.grid().width();
                int height = master.grid().height();
                List<float[]> channels = new ArrayList<>(3);
                for (int band : mapping.toBandNumbers(count)) {
                    BandData data = master.read(band, width, height, Resampling.NEAREST);
                    channels.add(data.values());
                }
                return new PixelBands(width, height, channels);
            } catch (IOException | RuntimeException e) {
                LOG.debug("Raster backend could not read master {}: {}", masterPath.getFileName(), e.toString());
            }
        }
        try {
            PixelBands bands = codec.readBands(masterPath);
            RgbBandMapping mapping = requested != null ? requested : RgbBandMapping.defaultFor(bands.bandCount());
            return bands.select(mapping.toBandNumbers(bands.bandCount()));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Image codec could not read master {}: {}", masterPath.getFileName(), e.toString());
            return null;
        }
    }
}
