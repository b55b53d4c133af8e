package com.phillippitts.satupscale.service.image;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Renders arbitrary band stacks as 8-bit RGB images.
 */
public final class RgbRendering {

    private RgbRendering() {
    }

    /**
     * Maps bands to RGB and stretches min-max over all three channels to 0..255.
     *
     * <p>One band is repeated into all channels; two bands become (1, 2, 2); bands beyond the
     * third are ignored. A constant image renders black.
     */
    public static BufferedImage stretchToRgb(PixelBands pixels) {
        List<float[]> rgb = toThreeChannels(pixels.bands());
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float[] channel : rgb) {
            for (float v : channel) {
                if (v < min) {
                    min = v;
                }
                if (v > max) {
                    max = v;
                }
            }
        }
        int width = pixels.width();
        int height = pixels.height();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        if (!(max > min)) {
            return image;
        }
        float range = max - min;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int r = toByte(rgb.get(0)[i], min, range);
                int g = toByte(rgb.get(1)[i], min, range);
                int b = toByte(rgb.get(2)[i], min, range);
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    /** Copies any image into an opaque {@code TYPE_INT_RGB} image. */
    public static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static List<float[]> toThreeChannels(List<float[]> bands) {
        if (bands.size() == 1) {
            return List.of(bands.get(0), bands.get(0), bands.get(0));
        }
        if (bands.size() == 2) {
            return List.of(bands.get(0), bands.get(1), bands.get(1));
        }
        return bands.subList(0, 3);
    }

    private static int toByte(float value, float min, float range) {
        int scaled = (int) ((value - min) / range * 255f);
        return Math.max(0, Math.min(255, scaled));
    }
}
