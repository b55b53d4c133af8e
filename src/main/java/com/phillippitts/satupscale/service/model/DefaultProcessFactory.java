package com.phillippitts.satupscale.service.model;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Starts model runtimes with {@link ProcessBuilder}.
 *
 * <p>The child reads from the null device and runs with unbuffered Python output, so stderr
 * captured before a timeout kill is complete up to that point.
 */
final class DefaultProcessFactory implements ProcessFactory {

    static final String PYTHON_UNBUFFERED = "PYTHONUNBUFFERED";

    private static final File NULL_DEVICE = new File(
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL" : "/dev/null");

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        return configure(command, workingDir).start();
    }

    ProcessBuilder configure(List<String> command, Path workingDir) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        ProcessBuilder builder = new ProcessBuilder(List.copyOf(command));
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        builder.redirectInput(ProcessBuilder.Redirect.from(NULL_DEVICE));
        builder.environment().put(PYTHON_UNBUFFERED, "1");
        return builder;
    }
}
