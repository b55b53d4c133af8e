package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.exception.SatUpscaleException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns user-selected files and folders into a de-duplicated list of input files.
 *
 * <p>Folders are walked recursively in sorted order and contribute only files with a supported
 * imagery suffix. Explicit file paths are kept whatever their suffix. Paths are resolved to
 * absolute, normalized form; the first occurrence wins.
 */
public final class InputExpander {

    public static final Set<String> SUPPORTED_SUFFIXES = Set.of(".tif", ".tiff", ".jp2", ".png", ".jpg", ".jpeg");

    private InputExpander() {
    }

    public static List<Path> expand(Collection<Path> selections) {
        Set<Path> seen = new LinkedHashSet<>();
        for (Path selection : selections) {
            if (Files.isDirectory(selection)) {
                for (Path child : listImagery(selection)) {
                    seen.add(resolve(child));
                }
            } else {
                seen.add(resolve(selection));
            }
        }
        return new ArrayList<>(seen);
    }

    public static boolean isSupported(Path path) {
        String ext = OutputNaming.extension(path).toLowerCase(Locale.ROOT);
        return SUPPORTED_SUFFIXES.contains(ext);
    }

    private static List<Path> listImagery(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(InputExpander::isSupported)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SatUpscaleException("Failed to list input folder " + dir, new UncheckedIOException(e));
        }
    }

    private static Path resolve(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
