package com.phillippitts.satupscale.service.model;

import com.phillippitts.satupscale.exception.ModelInvocationExceptionBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Locates installed models and builds their command lines.
 *
 * <p>Installations live under {@code <cacheDir>/<slug(name)>/<slug(version or "latest")>/} and
 * contain {@code weights.bin}, {@code manifest.json} and a {@code venv} virtual environment.
 * Entry points come from configuration, keyed by model display name.
 */
public final class ModelRuntimeResolver {

    static final String WEIGHTS_FILE = "weights.bin";
    static final String MANIFEST_FILE = "manifest.json";
    static final String VENV_DIR = "venv";

    private final Path cacheDir;
    private final Map<String, String> entrypoints;

    public ModelRuntimeResolver(Path cacheDir, Map<String, String> entrypoints) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
        this.entrypoints = entrypoints == null ? Map.of() : Map.copyOf(entrypoints);
    }

    /**
     * Resolves and validates an installation.
     *
     * @param cacheOverride cache root to use instead of the configured one (may be null)
     * @throws com.phillippitts.satupscale.exception.ModelInvocationException if no entry point is
     *         registered or installation files are missing
     */
    public ModelInstallation resolve(String modelName, String version, Path cacheOverride) {
        String entrypoint = entrypointFor(modelName);
        if (entrypoint == null) {
            throw ModelInvocationExceptionBuilder.create("No entrypoint registered")
                    .model(modelName)
                    .build();
        }
        Path root = cacheOverride != null ? cacheOverride : cacheDir;
        Path modelDir = root.resolve(slugify(modelName)).resolve(slugify(version == null ? "latest" : version));
        ModelInstallation installation = new ModelInstallation(
                modelName,
                modelDir,
                modelDir.resolve(WEIGHTS_FILE),
                modelDir.resolve(MANIFEST_FILE),
                modelDir.resolve(VENV_DIR),
                entrypoint);

        List<String> missing = new ArrayList<>();
        if (!Files.isRegularFile(installation.manifest())) {
            missing.add("manifest");
        }
        if (!Files.isRegularFile(installation.weights())) {
            missing.add("weights");
        }
        if (!Files.isRegularFile(installation.venv().resolve("pyvenv.cfg"))) {
            missing.add("venv");
        }
        if (!missing.isEmpty()) {
            throw ModelInvocationExceptionBuilder.create("Model not installed")
                    .model(modelName)
                    .metadata("missing", String.join(", ", missing))
                    .metadata("modelDir", modelDir)
                    .build();
        }
        if (installation.isScriptEntrypoint() && !Files.isRegularFile(installation.scriptPath())) {
            throw ModelInvocationExceptionBuilder.create("Model entrypoint missing")
                    .model(modelName)
                    .metadata("script", installation.scriptPath())
                    .build();
        }
        return installation;
    }

    /**
     * Command line for one invocation:
     * <pre>
     * python (script | -m module) --weights W --input I --output O [--scale S] [--tiling T] [--precision P] [--compute C]
     * </pre>
     */
    public List<String> buildCommand(ModelInstallation installation, ModelInvocation invocation) {
        List<String> cmd = new ArrayList<>();
        cmd.add(installation.pythonExecutable().toString());
        if (installation.isScriptEntrypoint()) {
            cmd.add(installation.scriptPath().toString());
        } else {
            cmd.add("-m");
            cmd.add(installation.entrypoint());
        }
        cmd.add("--weights");
        cmd.add(installation.weights().toString());
        cmd.add("--input");
        cmd.add(invocation.inputPath().toAbsolutePath().toString());
        cmd.add("--output");
        cmd.add(invocation.outputPath().toAbsolutePath().toString());
        addOption(cmd, "--scale", invocation.scale() == null ? null : String.valueOf(invocation.scale()));
        addOption(cmd, "--tiling", invocation.tiling());
        addOption(cmd, "--precision", invocation.precision());
        addOption(cmd, "--compute", invocation.compute());
        return cmd;
    }

    private String entrypointFor(String modelName) {
        String exact = entrypoints.get(modelName);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : entrypoints.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(modelName)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static void addOption(List<String> cmd, String flag, String value) {
        if (value != null) {
            cmd.add(flag);
            cmd.add(value);
        }
    }

    /**
     * Lower-cases, keeps alphanumerics and collapses every other run into a single dash.
     * Blank results become {@code model}.
     */
    static String slugify(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.strip().toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else if (!sb.isEmpty() && sb.charAt(sb.length() - 1) != '-') {
                sb.append('-');
            }
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == '-') {
            end--;
        }
        String slug = sb.substring(0, end);
        return slug.isEmpty() ? "model" : slug;
    }
}
