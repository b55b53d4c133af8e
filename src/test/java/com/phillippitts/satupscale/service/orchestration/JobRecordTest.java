package com.phillippitts.satupscale.service.orchestration;

import com.phillippitts.satupscale.service.job.CancellationToken;
import com.phillippitts.satupscale.service.upscale.UpscaleArtifact;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRecordTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void firstTerminalTransitionWins() {
        JobRecord record = new JobRecord("j", 2, NOW, new CancellationToken());
        record.markRunning();

        assertThat(record.finish(JobStatus.FAILED, "boom", NOW)).isTrue();
        assertThat(record.finish(JobStatus.COMPLETED, null, NOW)).isFalse();
        assertThat(record.status()).isEqualTo(JobStatus.FAILED);
        assertThat(record.error()).isEqualTo("boom");
    }

    @Test
    void cancellationClearsArtifacts() {
        JobRecord record = new JobRecord("j", 1, NOW, new CancellationToken());
        record.addArtifact(new UpscaleArtifact(Path.of("in.png"), Path.of("out/in_x2_master.png"), null, List.of()));

        record.finish(JobStatus.CANCELLED, null, NOW);

        assertThat(record.artifacts()).isEmpty();
    }

    @Test
    void markRunningOnlyMovesQueuedJobs() {
        JobRecord record = new JobRecord("j", 1, NOW, new CancellationToken());
        record.finish(JobStatus.CANCELLED, null, NOW);

        record.markRunning();

        assertThat(record.status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void registryRejectsDuplicateIds() {
        JobRegistry registry = new JobRegistry();
        registry.register(new JobRecord("j", 1, NOW, new CancellationToken()));

        assertThatThrownBy(() -> registry.register(new JobRecord("j", 1, NOW, new CancellationToken())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("other")).isEmpty();
    }
}
