package com.phillippitts.satupscale.service.upscale;

import java.util.Locale;
import java.util.Set;

/**
 * Format label rules: normalization, metadata preservation, file extensions and raster drivers.
 */
public final class OutputFormats {

    public static final String GTIFF_DRIVER = "GTiff";
    public static final String JP2_DRIVER = "JP2OpenJPEG";

    private static final Set<String> GEOSPATIAL = Set.of("GEOTIFF", "TIFF", "TIF", "JP2", "JPEG2000");
    private static final Set<String> IGNORED = Set.of("UNKNOWN", "NOT AN IMAGE");

    private OutputFormats() {
    }

    /**
     * Upper-cases and trims a label; {@code JPG} becomes {@code JPEG}.
     *
     * @return normalized label, or null for blank or placeholder labels
     */
    public static String normalize(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.strip().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || IGNORED.contains(normalized)) {
            return null;
        }
        return "JPG".equals(normalized) ? "JPEG" : normalized;
    }

    /** True for formats that carry georeferencing: GeoTIFF, TIFF and JPEG 2000. */
    public static boolean preservesMetadata(String label) {
        String normalized = normalize(label);
        return normalized != null && GEOSPATIAL.contains(normalized);
    }

    /** File extension including the dot; unknown formats map to {@code .tif}. */
    public static String extensionFor(String label) {
        String normalized = normalize(label);
        if (normalized == null) {
            return ".tif";
        }
        return switch (normalized) {
            case "JP2", "JPEG2000" -> ".jp2";
            case "PNG" -> ".png";
            case "JPEG" -> ".jpg";
            default -> ".tif";
        };
    }

    public static String driverFor(String label) {
        String normalized = normalize(label);
        if ("JP2".equals(normalized) || "JPEG2000".equals(normalized)) {
            return JP2_DRIVER;
        }
        return GTIFF_DRIVER;
    }
}
