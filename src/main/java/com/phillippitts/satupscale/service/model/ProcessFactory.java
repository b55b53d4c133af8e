package com.phillippitts.satupscale.service.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so model invocation can be tested without a real
 * python runtime.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a fake
 * {@link Process} with controlled output and exit behavior.
 */
interface ProcessFactory {
    /**
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @throws java.io.IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws java.io.IOException;
}
