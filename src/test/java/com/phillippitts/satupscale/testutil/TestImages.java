package com.phillippitts.satupscale.testutil;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small synthetic images for upscale tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /** Writes a {@code width x height} RGB gradient as PNG. */
    public static Path png(Path path, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = (x * 255) / Math.max(1, width - 1);
                int g = (y * 255) / Math.max(1, height - 1);
                image.setRGB(x, y, (r << 16) | (g << 8) | 128);
            }
        }
        Files.createDirectories(path.toAbsolutePath().getParent());
        if (!ImageIO.write(image, "png", path.toFile())) {
            throw new IOException("PNG writer unavailable");
        }
        return path;
    }

    /** Writes bytes no image decoder recognises. */
    public static Path garbage(Path path) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        return Files.writeString(path, "not an image");
    }

    public static BufferedImage read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unreadable image " + path);
        }
        return image;
    }
}
