package com.phillippitts.satupscale.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes, resizes and encodes ordinary raster images. Used for visual outputs and as the
 * fallback when no geospatial backend is available.
 */
public interface ImageCodec {

    /**
     * @throws IOException if the file cannot be read or no decoder recognises it
     */
    BufferedImage read(Path path) throws IOException;

    /**
     * Decodes an image into raw band values without colour conversion.
     *
     * @throws IOException if the file cannot be read or no decoder recognises it
     */
    PixelBands readBands(Path path) throws IOException;

    /** Bicubic resize to the given dimensions. */
    BufferedImage resize(BufferedImage image, int width, int height);

    /**
     * Encodes an image in the format implied by the file extension.
     *
     * @throws IOException if no encoder supports the extension or writing fails
     */
    void write(BufferedImage image, Path path) throws IOException;
}
