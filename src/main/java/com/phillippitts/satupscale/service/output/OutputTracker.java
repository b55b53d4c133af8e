package com.phillippitts.satupscale.service.output;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Claims every output path a job intends to write so that a failed or cancelled run can delete
 * exactly what it created.
 *
 * <p>{@link #outputPath} registers a path (relative paths resolve under the output directory) and
 * creates its parent directories. {@link #discard()} deletes every registered path deepest-first,
 * then any directory the tracker created that is now empty, then the output directory itself if it
 * ended up empty.
 *
 * <p>Single-writer: not safe for concurrent claims without external synchronization.
 */
public final class OutputTracker {

    private static final Logger LOG = LogManager.getLogger(OutputTracker.class);

    private final Path outputDir;
    private final Set<Path> paths = new LinkedHashSet<>();
    private final Set<Path> createdDirs = new LinkedHashSet<>();

    public OutputTracker(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path outputPath(String relativeOrAbsolute) throws IOException {
        return outputPath(Path.of(relativeOrAbsolute));
    }

    /**
     * Registers an output path and creates its parent directories.
     *
     * @param relativeOrAbsolute path relative to the output directory, or absolute
     * @return the registered path
     * @throws IOException if a parent directory cannot be created
     */
    public Path outputPath(Path relativeOrAbsolute) throws IOException {
        Path path = relativeOrAbsolute.isAbsolute() ? relativeOrAbsolute : outputDir.resolve(relativeOrAbsolute);
        Path parent = path.getParent();
        if (parent != null) {
            createParents(parent);
        }
        paths.add(path);
        return path;
    }

    /** @return claimed paths in claim order */
    public List<Path> claimedPaths() {
        return List.copyOf(paths);
    }

    /** @return number of claims so far; a mark for {@link #discardFrom(int)} */
    public int claimedCount() {
        return paths.size();
    }

    /**
     * Deletes every registered path, directories the tracker created that are now empty, and the
     * output directory if it is now empty. The tracker is empty afterwards.
     */
    public void discard() {
        deletePaths(new ArrayList<>(paths));
        paths.clear();
        removeEmptyCreatedDirs();
        removeIfEmpty(outputDir);
    }

    /**
     * Deletes only the paths claimed after {@code mark}, leaving earlier claims in place.
     *
     * @param mark a value previously returned by {@link #claimedCount()}
     */
    public void discardFrom(int mark) {
        List<Path> ordered = new ArrayList<>(paths);
        if (mark < 0 || mark > ordered.size()) {
            throw new IllegalArgumentException("mark out of range: " + mark);
        }
        List<Path> tail = new ArrayList<>(ordered.subList(mark, ordered.size()));
        deletePaths(tail);
        tail.forEach(paths::remove);
    }

    private void createParents(Path dir) throws IOException {
        List<Path> missing = new ArrayList<>();
        for (Path current = dir; current != null && !Files.exists(current); current = current.getParent()) {
            missing.add(current);
        }
        Files.createDirectories(dir);
        createdDirs.addAll(missing);
    }

    private void deletePaths(List<Path> targets) {
        targets.sort(Comparator.comparingInt(Path::getNameCount).reversed());
        for (Path path : targets) {
            try {
                if (Files.isDirectory(path)) {
                    deleteRecursively(path);
                } else {
                    Files.deleteIfExists(path);
                }
            } catch (IOException e) {
                LOG.warn("Failed to discard output {}: {}", path, e.toString());
            }
        }
    }

    private void removeEmptyCreatedDirs() {
        List<Path> dirs = new ArrayList<>(createdDirs);
        dirs.sort(Comparator.comparingInt(Path::getNameCount).reversed());
        for (Path dir : dirs) {
            removeIfEmpty(dir);
        }
        createdDirs.removeIf(dir -> !Files.exists(dir));
    }

    private static void removeIfEmpty(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            if (entries.iterator().hasNext()) {
                return;
            }
        } catch (IOException e) {
            LOG.warn("Failed to inspect directory {}: {}", dir, e.toString());
            return;
        }
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            LOG.debug("Directory {} filled concurrently; keeping it", dir);
        } catch (IOException e) {
            LOG.warn("Failed to remove empty directory {}: {}", dir, e.toString());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> ordered = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : ordered) {
                Files.deleteIfExists(p);
            }
        }
    }
}
