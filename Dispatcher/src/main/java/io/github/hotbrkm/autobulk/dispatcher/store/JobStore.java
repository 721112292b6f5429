package io.github.hotbrkm.autobulk.dispatcher.store;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of job definitions and their scheduling state.
 * All methods throw {@link StoreException} when the backing store fails.
 */
public interface JobStore {

    void insert(Job job);

    Optional<Job> findById(String jobId);

    /**
     * All jobs, newest first.
     */
    List<Job> findAll();

    List<Job> findByStatus(JobStatus status);

    /**
     * Active jobs whose {@code next_run_at <= now}, oldest-due first, at most {@code limit}.
     */
    List<Job> selectDue(Instant now, int limit);

    /**
     * Same selection as {@link #selectDue} restricted to unclaimed or lease-expired rows, claiming each returned job
     * for {@code workerId} until {@code now + leaseDuration}. A job is never claimed by two workers at once.
     */
    List<Job> claimDue(Instant now, int limit, String workerId, Duration leaseDuration);

    /**
     * Applies the scheduling state computed for a finished cycle and releases the lease, in one statement.
     * Only active rows still leased by {@code workerId} are updated, so a concurrent cancel wins and a worker whose
     * lease was taken over cannot overwrite the new holder's state. A {@code null} worker id matches unclaimed rows only.
     *
     * @return false if the job was no longer active or is no longer leased by {@code workerId}
     */
    boolean updateAfterExecution(String jobId, String workerId, JobStatus status, Instant nextRunAt, int retryCounter,
                                 Instant now);

    /**
     * Marks an active job cancelled and clears its next run.
     *
     * @return false if the job does not exist or is already terminal
     */
    boolean cancel(String jobId, Instant now);

    /**
     * Drops the lease held by {@code workerId} without touching scheduling state.
     */
    void releaseClaim(String jobId, String workerId);

    /**
     * Clears every lease that expired before {@code now}.
     *
     * @return number of released leases
     */
    int releaseExpiredClaims(Instant now);
}
