package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.exception.InputNotFoundException;
import com.phillippitts.satupscale.exception.ModelInvocationExceptionBuilder;
import com.phillippitts.satupscale.exception.RunCancelledException;
import com.phillippitts.satupscale.service.model.ModelInvocation;
import com.phillippitts.satupscale.service.model.ModelInvoker;
import com.phillippitts.satupscale.service.output.OutputTracker;
import com.phillippitts.satupscale.service.upscale.event.AllStrategiesFailedEvent;
import com.phillippitts.satupscale.service.upscale.event.UpscaleFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Fulfils upscale requests: one master output and an optional visual output per input, each
 * produced by an ordered fallback chain.
 *
 * <p>Master chain for metadata-preserving formats: geospatial rewrite, then a visual resize at
 * the input's extension, then a byte copy of the source. For other formats: the model (when one
 * is requested), then the built-in visual resize. Visual chain: the model (when requested), then
 * derivation from the master. Every fallback that runs leaves a note on the artifact.
 *
 * <p>Batches are transactional with respect to cancellation: when the cancel check fires before
 * or after a request, every output the batch created is deleted and {@link RunCancelledException}
 * propagates. Other failures propagate without rolling back earlier requests.
 */
@Service
public class UpscaleBatchService {

    private static final Logger LOG = LogManager.getLogger(UpscaleBatchService.class);

    public static final String MASTER_CHAIN = "master";
    public static final String VISUAL_CHAIN = "visual";

    static final String GEOSPATIAL_VISUAL_NOTE =
            "Geospatial export fallback: produced visual upscale because geospatial IO failed.";
    static final String GEOSPATIAL_COPY_NOTE =
            "Geospatial export fallback: copied source because image decoding failed.";

    private final GeospatialMasterWriter geospatialWriter;
    private final VisualResizer visualResizer;
    private final VisualExportBuilder visualExportBuilder;
    private final ModelInvoker modelInvoker;
    private final ApplicationEventPublisher publisher;

    @FunctionalInterface
    private interface IoAction {
        void run() throws Exception;
    }

    public UpscaleBatchService(GeospatialMasterWriter geospatialWriter,
                               VisualResizer visualResizer,
                               VisualExportBuilder visualExportBuilder,
                               ModelInvoker modelInvoker,
                               ApplicationEventPublisher publisher) {
        this.geospatialWriter = Objects.requireNonNull(geospatialWriter, "geospatialWriter");
        this.visualResizer = Objects.requireNonNull(visualResizer, "visualResizer");
        this.visualExportBuilder = Objects.requireNonNull(visualExportBuilder, "visualExportBuilder");
        this.modelInvoker = Objects.requireNonNull(modelInvoker, "modelInvoker");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Runs requests in order into {@code outputDir}, creating it up front.
     *
     * @param onProgress called with (completed, total, master path) after each request (may be null)
     * @param shouldCancel polled before and after each request (may be null)
     * @return one artifact per request, in request order; empty for an empty batch
     * @throws RunCancelledException if cancelled; all outputs of the batch are removed first
     */
    public List<UpscaleArtifact> runBatch(List<UpscaleRequest> requests, Path outputDir,
                                          BatchProgressListener onProgress, BooleanSupplier shouldCancel) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(outputDir, "outputDir");
        if (requests.isEmpty()) {
            return List.of();
        }
        return runBatch(requests, new OutputTracker(outputDir), onProgress, shouldCancel);
    }

    /**
     * Runs requests in order, claiming every output in {@code tracker}. The tracker stays usable
     * afterwards, so the caller can discard a finished batch.
     *
     * @see #runBatch(List, Path, BatchProgressListener, BooleanSupplier)
     */
    public List<UpscaleArtifact> runBatch(List<UpscaleRequest> requests, OutputTracker tracker,
                                          BatchProgressListener onProgress, BooleanSupplier shouldCancel) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(tracker, "tracker");
        if (requests.isEmpty()) {
            return List.of();
        }
        Path outputDir = tracker.outputDir();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }
        List<UpscaleArtifact> artifacts = new ArrayList<>(requests.size());
        int total = requests.size();
        try {
            for (int i = 0; i < total; i++) {
                checkCancelled(shouldCancel);
                UpscaleArtifact artifact = runRequest(requests.get(i), tracker);
                artifacts.add(artifact);
                if (onProgress != null) {
                    onProgress.onRequestCompleted(i + 1, total, artifact.masterOutputPath());
                }
                checkCancelled(shouldCancel);
            }
        } catch (RunCancelledException e) {
            LOG.info("Upscale batch cancelled after {}/{} request(s); discarding outputs in {}",
                    artifacts.size(), total, outputDir);
            tracker.discard();
            throw e;
        }
        LOG.info("Upscale batch finished: {} request(s) into {}", total, outputDir);
        return List.copyOf(artifacts);
    }

    /** Runs one request into {@code outputDir} with its own tracker. */
    public UpscaleArtifact runRequest(UpscaleRequest request, Path outputDir) {
        return runRequest(request, new OutputTracker(outputDir));
    }

    /**
     * Runs one request, claiming its outputs in {@code tracker}. If a chain is exhausted, paths
     * claimed by this request are deleted before the failure propagates.
     *
     * @throws IllegalArgumentException if the scale is not positive
     * @throws InputNotFoundException if the input is not a regular file
     * @throws com.phillippitts.satupscale.exception.UpscaleFailedException if every strategy of a chain failed
     */
    public UpscaleArtifact runRequest(UpscaleRequest request, OutputTracker tracker) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(tracker, "tracker");
        if (request.scale() <= 0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        if (!Files.isRegularFile(request.inputPath())) {
            throw new InputNotFoundException(request.inputPath());
        }
        int mark = tracker.claimedCount();
        try {
            return fulfil(request, tracker);
        } catch (RuntimeException e) {
            tracker.discardFrom(mark);
            throw e;
        }
    }

    private UpscaleArtifact fulfil(UpscaleRequest request, OutputTracker tracker) {
        ProvenanceNotes notes = new ProvenanceNotes();
        FallbackChain.FallbackListener listener = new EventPublishingListener();
        OutputPlan plan = request.outputPlan();

        Path master = OutputNaming.outputPath(tracker.outputDir(), request.inputPath(), request.scale(),
                plan.masterFormat(), OutputNaming.MASTER, request.outputTag());
        Path masterOutput = masterChain(request, master, tracker, notes).run(notes, listener);

        Path visualOutput = null;
        if (plan.hasVisual()) {
            Path visual = OutputNaming.outputPath(tracker.outputDir(), request.inputPath(), request.scale(),
                    plan.visualFormat(), OutputNaming.VISUAL, request.outputTag());
            visualOutput = visualChain(request, masterOutput, visual, tracker).run(notes, listener);
        }

        LOG.info("Upscaled {} -> {} (notes={})", request.inputPath().getFileName(), masterOutput.getFileName(),
                notes.snapshot().size());
        return new UpscaleArtifact(request.inputPath(), masterOutput, visualOutput, notes.snapshot());
    }

    private FallbackChain<Path> masterChain(UpscaleRequest request, Path master, OutputTracker tracker,
                                            ProvenanceNotes notes) {
        FallbackChain.Builder<Path> chain = FallbackChain.named(MASTER_CHAIN);
        if (OutputFormats.preservesMetadata(request.outputPlan().masterFormat())) {
            String inputExt = OutputNaming.extension(request.inputPath());
            Path fallback = OutputNaming.withExtension(master, inputExt.isEmpty() ? ".bin" : inputExt);
            return chain
                    .then("geospatial-rewrite", () -> {
                        Path claimed = tracker.outputPath(master);
                        try {
                            return geospatialWriter.write(request, claimed, tracker, notes);
                        } catch (Exception e) {
                            deleteQuietly(claimed);
                            throw e;
                        }
                    })
                    .then("visual-resize", () -> produce(tracker, fallback, () -> resizeInput(request, fallback)),
                            GEOSPATIAL_VISUAL_NOTE)
                    .then("source-copy", () -> produce(tracker, fallback, () -> Files.copy(request.inputPath(),
                                    fallback, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES)),
                            GEOSPATIAL_COPY_NOTE)
                    .build();
        }
        if (request.hasModel()) {
            chain.then("model", () -> produce(tracker, master, () -> runModel(request, master)));
            chain.then("visual-resize", () -> produce(tracker, master, () -> resizeInput(request, master)),
                    "Model '" + request.modelName() + "' unavailable; used built-in visual upscale fallback.");
        } else {
            chain.then("visual-resize", () -> produce(tracker, master, () -> resizeInput(request, master)));
        }
        return chain.build();
    }

    private FallbackChain<Path> visualChain(UpscaleRequest request, Path masterOutput, Path visual,
                                            OutputTracker tracker) {
        FallbackChain.Builder<Path> chain = FallbackChain.named(VISUAL_CHAIN);
        IoAction derive = () -> visualExportBuilder.build(request, masterOutput, visual);
        if (request.hasModel()) {
            chain.then("model", () -> produce(tracker, visual, () -> runModel(request, visual)));
            chain.then("derive-from-master", () -> produce(tracker, visual, derive),
                    "Model '" + request.modelName() + "' unavailable for visual export; used built-in fallback.");
        } else {
            chain.then("derive-from-master", () -> produce(tracker, visual, derive));
        }
        return chain.build();
    }

    private void resizeInput(UpscaleRequest request, Path output) throws IOException {
        visualResizer.resize(request.inputPath(), output, request.scale(), request.bandHandling(),
                request.rgbMapping());
    }

    /**
     * Invokes the model and checks only that {@code output} now exists.
     *
     * @throws com.phillippitts.satupscale.exception.ModelInvocationException if the model wrote nothing
     */
    private void runModel(UpscaleRequest request, Path output) {
        modelInvoker.invoke(new ModelInvocation(
                request.modelName(),
                request.modelVersion(),
                request.modelCacheDir(),
                request.inputPath(),
                output,
                request.scale(),
                request.tiling(),
                request.precision(),
                request.compute()));
        if (!Files.isRegularFile(output)) {
            throw ModelInvocationExceptionBuilder.create("Model produced no output")
                    .model(request.modelName())
                    .metadata("output", output)
                    .build();
        }
    }

    /** Claims {@code target}, runs the action and removes a partial file if it fails. */
    private static Path produce(OutputTracker tracker, Path target, IoAction action) throws Exception {
        Path claimed = tracker.outputPath(target);
        try {
            action.run();
        } catch (Exception e) {
            deleteQuietly(claimed);
            throw e;
        }
        return claimed;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not remove partial output {}: {}", path, e.toString());
        }
    }

    private static void checkCancelled(BooleanSupplier shouldCancel) {
        if (shouldCancel != null && shouldCancel.getAsBoolean()) {
            throw new RunCancelledException("Upscale run cancelled");
        }
    }

    /** Publishes non-PII fallback events for observability. */
    private final class EventPublishingListener implements FallbackChain.FallbackListener {

        @Override
        public void onStrategyFailed(String chain, String strategy, Exception failure) {
            publisher.publishEvent(new UpscaleFallbackEvent(chain, strategy,
                    failure.getClass().getSimpleName(), Instant.now()));
        }

        @Override
        public void onExhausted(String chain, Exception lastFailure) {
            publisher.publishEvent(new AllStrategiesFailedEvent(chain,
                    lastFailure.getClass().getSimpleName(), Instant.now()));
        }
    }
}
