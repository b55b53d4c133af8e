package com.phillippitts.satupscale.service.model;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout of one installed model version.
 *
 * @param entrypoint python module name or script path; relative scripts resolve under {@link #modelDir}
 */
public record ModelInstallation(
        String modelName,
        Path modelDir,
        Path weights,
        Path manifest,
        Path venv,
        String entrypoint
) {

    /** Python interpreter inside the model's virtual environment. */
    public Path pythonExecutable() {
        Path windows = venv.resolve("Scripts").resolve("python.exe");
        if (Files.isRegularFile(windows)) {
            return windows;
        }
        return venv.resolve("bin").resolve("python");
    }

    /** True when the entrypoint names a script rather than a module. */
    public boolean isScriptEntrypoint() {
        return entrypoint.endsWith(".py") || entrypoint.contains("/") || entrypoint.contains("\\");
    }

    public Path scriptPath() {
        Path script = Path.of(entrypoint);
        return script.isAbsolute() ? script : modelDir.resolve(script);
    }
}
