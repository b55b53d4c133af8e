package com.phillippitts.satupscale.presentation.controller;

import com.phillippitts.satupscale.service.orchestration.JobRecord;
import com.phillippitts.satupscale.service.upscale.UpscaleArtifact;

import java.time.Instant;
import java.util.List;

/** JSON view of a job's state. */
public record JobView(
        String jobId,
        String status,
        int completed,
        int total,
        double progress,
        Double etaSeconds,
        List<ArtifactView> artifacts,
        String error,
        Instant submittedAt,
        Instant finishedAt
) {

    public record ArtifactView(String input, String master, String visual, List<String> notes) {

        static ArtifactView of(UpscaleArtifact artifact) {
            return new ArtifactView(
                    artifact.inputPath().toString(),
                    artifact.masterOutputPath().toString(),
                    artifact.visualOutput().map(Object::toString).orElse(null),
                    artifact.notes());
        }
    }

    static JobView of(JobRecord record) {
        return new JobView(
                record.jobId(),
                record.status().name(),
                record.completedRequests(),
                record.totalRequests(),
                record.progress(),
                record.etaSeconds(),
                record.artifacts().stream().map(ArtifactView::of).toList(),
                record.error(),
                record.submittedAt(),
                record.finishedAt());
    }
}
