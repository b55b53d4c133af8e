package com.phillippitts.satupscale.service.model;

import com.phillippitts.satupscale.exception.ModelInvocationException;
import com.phillippitts.satupscale.exception.ModelInvocationExceptionBuilder;
import com.phillippitts.satupscale.util.ProcessTimeouts;
import com.phillippitts.satupscale.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a model's python entry point as a child process.
 *
 * <p>Responsibilities:
 * - Resolve and validate the installation via {@link ModelRuntimeResolver}
 * - Start the process via {@link ProcessFactory} in the model directory
 * - Drain stdout (logged at debug) and stderr (kept for diagnostics) concurrently
 * - Enforce a timeout and terminate runaway processes
 * - Report failures as {@link ModelInvocationException} with exit code, duration and stderr
 *
 * <p>Each call owns its process; concurrent calls do not share state.
 */
public final class ProcessModelInvoker implements ModelInvoker {

    private static final Logger LOG = LogManager.getLogger(ProcessModelInvoker.class);

    static final int STDOUT_MAX_BYTES = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 2000;

    private final ModelRuntimeResolver resolver;
    private final ProcessFactory processFactory;
    private final Duration timeout;
    private final int maxStderrBytes;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public ProcessModelInvoker(ModelRuntimeResolver resolver, Duration timeout, int maxStderrBytes) {
        this(resolver, new DefaultProcessFactory(), timeout, maxStderrBytes);
    }

    ProcessModelInvoker(ModelRuntimeResolver resolver, ProcessFactory processFactory,
                        Duration timeout, int maxStderrBytes) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (maxStderrBytes <= 0) {
            throw new IllegalArgumentException("maxStderrBytes must be positive");
        }
        this.maxStderrBytes = maxStderrBytes;
    }

    @Override
    public void invoke(ModelInvocation invocation) {
        Objects.requireNonNull(invocation, "invocation");
        if (!Files.isRegularFile(invocation.inputPath())) {
            throw ModelInvocationExceptionBuilder.create("Input file missing")
                    .model(invocation.modelName())
                    .metadata("input", invocation.inputPath())
                    .build();
        }
        ModelInstallation installation = resolver.resolve(
                invocation.modelName(), invocation.modelVersion(), invocation.cacheDir());
        List<String> command = resolver.buildCommand(installation, invocation);
        long startTime = System.nanoTime();

        ProcessExecution exec = null;
        try {
            Path parent = invocation.outputPath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            LOG.info("Running model '{}' on {}", invocation.modelName(), invocation.inputPath().getFileName());
            exec = start(command, installation.modelDir());
            waitForCompletion(exec, invocation, startTime);
            checkResult(exec, invocation, startTime);
            LOG.info("Model '{}' finished in {} ms", invocation.modelName(), TimeUtils.elapsedMillis(startTime));
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw failure("I/O failure: " + e.getMessage(), invocation, -1,
                    exec == null ? null : exec.stderr(), startTime, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution start(List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, workingDir);
        // Start gobblers before waiting to avoid pipe deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "model-out", STDOUT_MAX_BYTES);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "model-err", maxStderrBytes);
        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForCompletion(ProcessExecution exec, ModelInvocation invocation, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw failure("Timeout after " + timeout.toSeconds() + "s", invocation, -1,
                    exec.stderr(), startTime, null);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private void checkResult(ProcessExecution exec, ModelInvocation invocation, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw failure("Non-zero exit: " + exitCode, invocation, exitCode, exec.stderr(), startTime, null);
        }
        if (!Files.exists(invocation.outputPath())) {
            throw failure("Model produced no output", invocation, exitCode, exec.stderr(), startTime, null);
        }
        if (!exec.stdout().isEmpty()) {
            LOG.debug("Model '{}' stdout: {}", invocation.modelName(), exec.stdout());
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Once the cap is reached the stream is still drained so the
     * child never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Model process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying model process");
        }
    }

    private static ModelInvocationException failure(String msg, ModelInvocation invocation, int exitCode,
                                                    StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        ModelInvocationExceptionBuilder builder = ModelInvocationExceptionBuilder.create(msg)
                .model(invocation.modelName())
                .exitCode(exitCode)
                .durationMs(TimeUtils.nanosToMillis(System.nanoTime() - startNano))
                .metadata("input", invocation.inputPath().getFileName())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
