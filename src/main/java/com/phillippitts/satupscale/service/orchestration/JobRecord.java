package com.phillippitts.satupscale.service.orchestration;

import com.phillippitts.satupscale.service.job.CancellationToken;
import com.phillippitts.satupscale.service.job.JobResult;
import com.phillippitts.satupscale.service.upscale.UpscaleArtifact;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Live state of one submitted job. Written by the queue worker, read by request threads.
 */
public final class JobRecord {

    private final String jobId;
    private final int totalRequests;
    private final Instant submittedAt;
    private final CancellationToken cancellation;
    private final List<UpscaleArtifact> artifacts = new ArrayList<>();

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile int completedRequests;
    private volatile Double etaSeconds;
    private volatile String error;
    private volatile Instant finishedAt;
    private volatile CompletableFuture<JobResult> future;

    JobRecord(String jobId, int totalRequests, Instant submittedAt, CancellationToken cancellation) {
        this.jobId = jobId;
        this.totalRequests = totalRequests;
        this.submittedAt = submittedAt;
        this.cancellation = cancellation;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }

    public int totalRequests() {
        return totalRequests;
    }

    public int completedRequests() {
        return completedRequests;
    }

    public double progress() {
        return totalRequests == 0 ? 0d : (double) completedRequests / totalRequests;
    }

    /** @return estimated seconds remaining, or null when unknown */
    public Double etaSeconds() {
        return etaSeconds;
    }

    /** @return failure message, or null */
    public String error() {
        return error;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    /** @return finish time, or null while the job is pending */
    public Instant finishedAt() {
        return finishedAt;
    }

    public List<UpscaleArtifact> artifacts() {
        synchronized (artifacts) {
            return List.copyOf(artifacts);
        }
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    CompletableFuture<JobResult> future() {
        return future;
    }

    void attach(CompletableFuture<JobResult> future) {
        this.future = future;
    }

    void markRunning() {
        if (status == JobStatus.QUEUED) {
            status = JobStatus.RUNNING;
        }
    }

    void progress(int completed, Double eta) {
        this.completedRequests = completed;
        this.etaSeconds = eta;
    }

    void addArtifact(UpscaleArtifact artifact) {
        synchronized (artifacts) {
            artifacts.add(artifact);
        }
    }

    void replaceArtifacts(List<UpscaleArtifact> finished) {
        synchronized (artifacts) {
            artifacts.clear();
            artifacts.addAll(finished);
        }
    }

    synchronized boolean finish(JobStatus terminal, String failure, Instant at) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = terminal;
        this.error = failure;
        this.finishedAt = at;
        if (terminal == JobStatus.CANCELLED) {
            replaceArtifacts(List.of());
        }
        return true;
    }
}
