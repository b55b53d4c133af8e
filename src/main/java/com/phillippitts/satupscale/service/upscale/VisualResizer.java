package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.image.ImageCodec;
import com.phillippitts.satupscale.service.image.PixelBands;
import com.phillippitts.satupscale.service.image.RgbRendering;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Built-in upscale: decode, render as RGB, bicubic resize by the scale factor and save.
 *
 * <p>{@link BandHandling#RGB_ONLY} uses the decoder's own colour conversion. Other policies read
 * raw bands, reduce more than three bands through the RGB mapping (or the first three), and
 * min-max stretch to 8 bits before resizing.
 */
public final class VisualResizer {

    private final ImageCodec codec;

    public VisualResizer(ImageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @throws IOException if the input cannot be decoded or the output cannot be encoded
     */
    public void resize(Path input, Path output, int scale, BandHandling bandHandling,
                       RgbBandMapping mapping) throws IOException {
        BufferedImage rendered;
        if (bandHandling == BandHandling.RGB_ONLY) {
            rendered = RgbRendering.toRgb(codec.read(input));
        } else {
            PixelBands bands = codec.readBands(input);
            if (bands.bandCount() > 3) {
                bands = mapping != null
                        ? bands.select(mapping.toBandNumbers(bands.bandCount()))
                        : bands.select(1, 2, 3);
            }
            rendered = RgbRendering.stretchToRgb(bands);
        }
        BufferedImage resized = codec.resize(rendered, rendered.getWidth() * scale, rendered.getHeight() * scale);
        codec.write(resized, output);
    }
}
