package com.phillippitts.satupscale.service.job;

import com.phillippitts.satupscale.config.logging.LogContextKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs jobs sequentially on a single background worker thread.
 *
 * <p>Jobs are drained strictly FIFO; a job's units never interleave with another job's units.
 * {@link #submit} never blocks: it enqueues and returns a pending future that the worker completes
 * with the {@link JobResult} or with the exception the job raised. A failed job does not stop the
 * queue.
 *
 * <p>After {@link #shutdown(boolean)}, {@link #submit} fails fast with {@link IllegalStateException};
 * jobs queued before the shutdown are still drained. Shutdown is idempotent.
 *
 * <p>The submitter's Log4j2 {@link ThreadContext} is copied onto the worker for the duration of the
 * job, with {@code jobId} added, so job logs keep their request correlation.
 */
public final class JobQueue implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(JobQueue.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final String DEFAULT_THREAD_NAME = "job-queue";

    private final JobRunner runner;
    private final Duration pollInterval;
    private final BlockingQueue<QueueItem> queue = new LinkedBlockingQueue<>();
    private final Map<CompletableFuture<JobResult>, QueueItem> itemsByFuture = new ConcurrentHashMap<>();
    private final Object submitLock = new Object();
    private final Thread worker;

    private volatile boolean shutdown;

    private record QueueItem(
            Job job,
            JobProgressListener onProgress,
            CompletableFuture<JobResult> future,
            Map<String, String> context,
            AtomicBoolean claimed
    ) {}

    /** Sentinel enqueued by shutdown so the worker exits after draining earlier jobs. */
    private static final QueueItem POISON = new QueueItem(null, null, null, Map.of(), new AtomicBoolean());

    public JobQueue() {
        this(null, null, null);
    }

    public JobQueue(JobRunner runner) {
        this(runner, null, null);
    }

    /**
     * Creates a queue from either a runner or raw runner collaborators, never both.
     *
     * @param runner runner to execute jobs with (may be null)
     * @param events event sink for a runner created by the queue (may be null)
     * @param clock clock for a runner created by the queue (may be null)
     * @throws IllegalArgumentException if a runner and collaborators are both supplied
     */
    public JobQueue(JobRunner runner, JobEventLogger events, MonotonicClock clock) {
        this(runner, events, clock, DEFAULT_POLL_INTERVAL, DEFAULT_THREAD_NAME);
    }

    public JobQueue(JobRunner runner, JobEventLogger events, MonotonicClock clock,
                    Duration pollInterval, String threadName) {
        if (runner != null && (events != null || clock != null)) {
            throw new IllegalArgumentException("Provide either a runner or logger/clock, not both");
        }
        this.runner = runner != null ? runner : new JobRunner(events, clock);
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.worker = new Thread(this::drain, Objects.requireNonNull(threadName, "threadName"));
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Enqueues a job and returns immediately.
     *
     * @param job job to run
     * @param onProgress per-unit progress listener (may be null)
     * @return future completed by the worker with the result or the job's exception
     * @throws IllegalStateException if the queue has been shut down
     */
    public CompletableFuture<JobResult> submit(Job job, JobProgressListener onProgress) {
        Objects.requireNonNull(job, "job");
        synchronized (submitLock) {
            if (shutdown) {
                throw new IllegalStateException("Job queue is shut down");
            }
            CompletableFuture<JobResult> future = new CompletableFuture<>();
            QueueItem item = new QueueItem(job, onProgress, future, ThreadContext.getImmutableContext(),
                    new AtomicBoolean());
            itemsByFuture.put(future, item);
            queue.add(item);
            LOG.debug("Queued job {} (pending={})", job.jobId(), queue.size());
            return future;
        }
    }

    public CompletableFuture<JobResult> submit(Job job) {
        return submit(job, null);
    }

    /**
     * Cancels a submitted job by signalling its cancellation token.
     *
     * <p>A job that has not started yet is skipped by the worker and its future is cancelled here.
     * A running job stops at its next unit boundary; only the worker completes its future, after
     * the job's cancel hook has run.
     *
     * @return false if the future is unknown or already finished
     */
    public boolean cancel(CompletableFuture<JobResult> future) {
        QueueItem item = itemsByFuture.get(future);
        if (item == null) {
            return false;
        }
        item.job().cancellation().cancel();
        if (item.claimed().compareAndSet(false, true)) {
            future.cancel(false);
            LOG.info("Cancelled queued job {}", item.job().jobId());
        } else {
            LOG.info("Cancellation requested for running job {}", item.job().jobId());
        }
        return true;
    }

    /** Shuts down and waits for the worker to drain queued jobs. */
    public void shutdown() {
        shutdown(true);
    }

    /**
     * Stops accepting jobs. Jobs already queued still run.
     *
     * @param wait whether to block until the worker has drained the queue and exited
     */
    public void shutdown(boolean wait) {
        synchronized (submitLock) {
            if (!shutdown) {
                shutdown = true;
                queue.add(POISON);
                LOG.info("Job queue shutting down (pending={})", queue.size() - 1);
            }
        }
        if (wait && Thread.currentThread() != worker) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for job queue worker");
            }
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void close() {
        shutdown(true);
    }

    private void drain() {
        while (true) {
            QueueItem item;
            try {
                item = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Job queue worker interrupted; exiting");
                return;
            }
            if (item == null) {
                if (shutdown && queue.isEmpty()) {
                    return;
                }
                continue;
            }
            if (item == POISON) {
                return;
            }
            try {
                execute(item);
            } finally {
                itemsByFuture.remove(item.future());
            }
        }
    }

    private void execute(QueueItem item) {
        CompletableFuture<JobResult> future = item.future();
        if (!item.claimed().compareAndSet(false, true) || future.isDone()) {
            LOG.info("Skipping job {}: cancelled before start", item.job().jobId());
            return;
        }
        Map<String, String> previous = ThreadContext.getImmutableContext();
        try {
            if (!item.context().isEmpty()) {
                ThreadContext.putAll(item.context());
            }
            ThreadContext.put(LogContextKeys.JOB_ID, item.job().jobId());
            JobResult result = runner.run(item.job(), item.onProgress());
            future.complete(result);
        } catch (Throwable t) {
            LOG.debug("Job {} ended exceptionally: {}", item.job().jobId(), t.toString());
            future.completeExceptionally(t);
        } finally {
            ThreadContext.clearAll();
            if (!previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
    }
}
