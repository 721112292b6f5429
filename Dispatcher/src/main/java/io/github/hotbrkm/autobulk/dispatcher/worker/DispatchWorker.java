package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import io.github.hotbrkm.autobulk.dispatcher.store.StoreException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Polls the job store for due jobs and runs them one at a time.
 * <p>
 * Each tick claims up to {@code batchLimit} due jobs under a lease and processes them in due order.
 * Store failures abandon the affected job for this tick without consuming a retry.
 */
@Slf4j
public class DispatchWorker {

    private final JobStore jobStore;
    private final JobExecutionProcessor jobExecutionProcessor;
    private final StaleClaimRecovery staleClaimRecovery;
    private final WorkerExecutors workerExecutors;
    private final Clock clock;
    @Getter
    private final WorkerRuntimeOptions options;

    private volatile boolean isRunning;

    DispatchWorker(JobStore jobStore, JobExecutionProcessor jobExecutionProcessor, StaleClaimRecovery staleClaimRecovery,
                   WorkerExecutors workerExecutors, Clock clock, WorkerRuntimeOptions options) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobExecutionProcessor = Objects.requireNonNull(jobExecutionProcessor, "jobExecutionProcessor must not be null");
        this.staleClaimRecovery = Objects.requireNonNull(staleClaimRecovery, "staleClaimRecovery must not be null");
        this.workerExecutors = Objects.requireNonNull(workerExecutors, "workerExecutors must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Runs start-up recovery and schedules the poll loop.
     */
    public void start() {
        if (isRunning) {
            log.warn("Dispatch worker is already running");
            return;
        }
        log.info("Starting dispatch worker [{}] (poll interval: {} ms, batch limit: {})",
                options.workerId(), options.pollIntervalMs(), options.batchLimit());
        recover();
        isRunning = true;
        workerExecutors.scheduleWithFixedDelay(this::tick, 0, options.pollIntervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Releases expired leases and reconciles inconsistent jobs.
     *
     * @return number of recovered claims and jobs
     */
    public int recover() {
        try {
            return staleClaimRecovery.recover(clock.instant());
        } catch (StoreException e) {
            log.error("Start-up recovery failed; continuing with the poll loop", e);
            return 0;
        }
    }

    /**
     * Claims and processes the jobs due now.
     *
     * @return number of jobs processed to completion
     * @throws StoreException if the claim query fails
     */
    public int pollOnce() {
        Instant now = clock.instant();
        List<Job> claimed = jobStore.claimDue(now, options.batchLimit(), options.workerId(),
                Duration.ofMillis(options.leaseTimeoutMs()));
        if (claimed.isEmpty()) {
            return 0;
        }
        log.debug("Worker [{}] claimed {} due jobs", options.workerId(), claimed.size());

        int processed = 0;
        for (int i = 0; i < claimed.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                releaseRemaining(claimed.subList(i, claimed.size()));
                break;
            }
            if (processOne(claimed.get(i))) {
                processed++;
            }
        }
        return processed;
    }

    /**
     * Stops the poll loop and waits for the running tick to finish.
     */
    public void shutdown() {
        log.info("Shutting down dispatch worker [{}]...", options.workerId());
        isRunning = false;
        workerExecutors.shutdown();
        log.info("Dispatch worker shut down completed");
    }

    public boolean isRunning() {
        return isRunning;
    }

    private void tick() {
        if (!isRunning) {
            return;
        }
        try {
            pollOnce();
        } catch (StoreException e) {
            log.error("Poll tick aborted: could not claim due jobs", e);
        } catch (RuntimeException e) {
            // keep the scheduled loop alive
            log.error("Poll tick failed unexpectedly", e);
        }
    }

    private boolean processOne(Job job) {
        try {
            return jobExecutionProcessor.process(job).isPresent();
        } catch (StoreException e) {
            log.error("Job [{}] abandoned for this tick: store failure", job.getId(), e);
        } catch (RuntimeException e) {
            log.error("Job [{}] abandoned for this tick: unexpected failure", job.getId(), e);
        }
        releaseQuietly(job);
        return false;
    }

    private void releaseRemaining(List<Job> jobs) {
        log.info("Worker interrupted; releasing {} unprocessed claims", jobs.size());
        jobs.forEach(this::releaseQuietly);
    }

    private void releaseQuietly(Job job) {
        try {
            jobStore.releaseClaim(job.getId(), options.workerId());
        } catch (StoreException e) {
            log.warn("Could not release claim of job [{}]; it becomes claimable when the lease expires", job.getId(), e);
        }
    }
}
