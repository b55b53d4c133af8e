package com.phillippitts.satupscale.service.upscale;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Builds output file names of the form {@code <stem>_x<scale>[_<tag>]_<role><ext>}.
 */
public final class OutputNaming {

    public static final String MASTER = "master";
    public static final String VISUAL = "visual";

    private OutputNaming() {
    }

    public static Path outputPath(Path outputDir, Path inputPath, int scale, String formatLabel,
                                  String role, String outputTag) {
        StringBuilder name = new StringBuilder(stem(inputPath)).append("_x").append(scale);
        if (outputTag != null) {
            String tag = sanitizeTag(outputTag);
            if (!tag.isEmpty()) {
                name.append('_').append(tag);
            }
        }
        name.append('_').append(role).append(OutputFormats.extensionFor(formatLabel));
        return outputDir.resolve(name.toString());
    }

    /**
     * Lower-cases a tag, keeps alphanumerics, collapses every other run into a single dash and
     * trims dashes from both ends. {@code "Model A"} becomes {@code "model-a"}.
     */
    public static String sanitizeTag(String value) {
        StringBuilder sb = new StringBuilder();
        boolean previousDash = false;
        for (char c : value.strip().toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
                previousDash = false;
            } else if (!previousDash) {
                sb.append('-');
                previousDash = true;
            }
        }
        int start = 0;
        int end = sb.length();
        while (start < end && sb.charAt(start) == '-') {
            start++;
        }
        while (end > start && sb.charAt(end - 1) == '-') {
            end--;
        }
        return sb.substring(start, end);
    }

    /** File name without its last extension. */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Last extension including the dot, or an empty string. */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    /** Replaces the last extension of {@code path} with {@code newExtension}. */
    public static Path withExtension(Path path, String newExtension) {
        return path.resolveSibling(stem(path) + newExtension);
    }
}
