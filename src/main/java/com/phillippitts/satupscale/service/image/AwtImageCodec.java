package com.phillippitts.satupscale.service.image;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ImageCodec} backed by {@link ImageIO} and Java2D.
 *
 * <p>Supports whatever ImageIO plugins are on the classpath; the JDK covers PNG, JPEG, BMP, GIF
 * and TIFF. Paletted images are expanded to RGB before their bands are read.
 */
public final class AwtImageCodec implements ImageCodec {

    private static final Logger LOG = LogManager.getLogger(AwtImageCodec.class);

    @Override
    public BufferedImage read(Path path) throws IOException {
        BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + path.getFileName());
        }
        return image;
    }

    @Override
    public PixelBands readBands(Path path) throws IOException {
        BufferedImage image = read(path);
        if (image.getColorModel() instanceof IndexColorModel) {
            image = RgbRendering.toRgb(image);
        }
        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        List<float[]> bands = new ArrayList<>(raster.getNumBands());
        for (int b = 0; b < raster.getNumBands(); b++) {
            bands.add(raster.getSamples(0, 0, width, height, b, (float[]) null));
        }
        return new PixelBands(width, height, bands);
    }

    @Override
    public BufferedImage resize(BufferedImage image, int width, int height) {
        int type = image.getType() == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_RGB : image.getType();
        BufferedImage resized = new BufferedImage(width, height, type);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    @Override
    public void write(BufferedImage image, Path path) throws IOException {
        String format = formatName(path);
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        boolean written = ImageIO.write(image, format, path.toFile());
        if (!written) {
            Files.deleteIfExists(path);
            throw new IOException("No image writer for format '" + format + "'");
        }
        LOG.debug("Wrote {}x{} {} image to {}", image.getWidth(), image.getHeight(), format, path);
    }

    static String formatName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "png";
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "jpg", "jpeg" -> "jpeg";
            case "tif", "tiff" -> "tiff";
            default -> ext;
        };
    }
}
