package com.phillippitts.satupscale.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes processing reports atomically: the JSON goes to {@code <name>.tmp} beside the target,
 * which is then moved over the destination. Readers never see a half-written report.
 */
public final class ProcessingReportWriter {

    private static final Logger LOG = LogManager.getLogger(ProcessingReportWriter.class);

    private static final int INDENT = 2;

    public void write(ProcessingReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, report.toJson().toString(INDENT), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.info("Wrote processing report {}", path);
    }
}
