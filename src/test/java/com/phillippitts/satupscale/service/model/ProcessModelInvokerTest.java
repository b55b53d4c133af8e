package com.phillippitts.satupscale.service.model;

import com.phillippitts.satupscale.exception.ModelInvocationException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.satupscale.service.model.ModelTestDoubles.ProcessBehavior;
import static com.phillippitts.satupscale.service.model.ModelTestDoubles.StubProcessFactory;
import static com.phillippitts.satupscale.service.model.ModelTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessModelInvokerTest {

    @TempDir
    Path tempDir;

    private ModelRuntimeResolver resolver;
    private Path modelDir;
    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        Path cache = tempDir.resolve("models");
        modelDir = ModelTestDoubles.installModel(cache, "satellitesr", "latest");
        resolver = new ModelRuntimeResolver(cache, Map.of("SatelliteSR", "satsr.cli"));
        input = Files.writeString(tempDir.resolve("scene.tif"), "raster");
        output = tempDir.resolve("out/scene_x4_master.tif");
    }

    private ModelInvocation invocation() {
        return new ModelInvocation("SatelliteSR", null, null, input, output, 4, null, null, null);
    }

    @Test
    void successRunsInModelDirAndCreatesOutputParent() {
        TestProcess tp = new TestProcess(new ProcessBehavior("done", "", 0, 0));
        StubProcessFactory factory = new StubProcessFactory(tp, output);
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, factory, Duration.ofSeconds(5), 1024);

        invoker.invoke(invocation());

        assertThat(output).exists();
        assertThat(factory.workingDirs).containsExactly(modelDir);
        assertThat(factory.commands.get(0)).contains("-m", "satsr.cli", "--scale", "4");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "CUDA out of memory", 2, 0));
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, new StubProcessFactory(tp),
                Duration.ofSeconds(5), 1024);

        assertThatThrownBy(() -> invoker.invoke(invocation()))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("stderr=CUDA out of memory")
                .hasMessageContaining("model: SatelliteSR");
    }

    @Test
    void cleanExitWithoutOutputFileFails() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, new StubProcessFactory(tp),
                Duration.ofSeconds(5), 1024);

        assertThatThrownBy(() -> invoker.invoke(invocation()))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("Model produced no output");
    }

    @Test
    void timeoutKillsProcessAndThrows() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1));
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, new StubProcessFactory(tp),
                Duration.ofSeconds(1), 1024);

        long start = System.nanoTime();
        assertThatThrownBy(() -> invoker.invoke(invocation()))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }

    @Test
    void missingInputFailsBeforeStartingProcess() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubProcessFactory factory = new StubProcessFactory(tp);
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, factory, Duration.ofSeconds(5), 1024);
        ModelInvocation missing = new ModelInvocation("SatelliteSR", null, null,
                tempDir.resolve("nope.tif"), output, 2, null, null, null);

        assertThatThrownBy(() -> invoker.invoke(missing))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("Input file missing");
        assertThat(factory.commands).isEmpty();
    }

    @Test
    void stderrIsCappedInFailureMessage() {
        String noisy = "x".repeat(5000);
        TestProcess tp = new TestProcess(new ProcessBehavior("", noisy, 1, 0));
        ProcessModelInvoker invoker = new ProcessModelInvoker(resolver, new StubProcessFactory(tp),
                Duration.ofSeconds(5), 100);

        assertThatThrownBy(() -> invoker.invoke(invocation()))
                .isInstanceOf(ModelInvocationException.class)
                .satisfies(e -> assertThat(e.getMessage()).doesNotContain("x".repeat(101)));
    }

    @Test
    void rejectsNonPositiveStderrCap() {
        assertThatThrownBy(() -> new ProcessModelInvoker(resolver, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
