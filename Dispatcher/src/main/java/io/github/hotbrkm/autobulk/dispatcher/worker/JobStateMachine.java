package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;
import io.github.hotbrkm.autobulk.dispatcher.schedule.RunScheduler;

import java.time.Instant;
import java.util.Objects;

/**
 * Computes the retry / dead-letter transition of an active job after a cycle.
 */
public class JobStateMachine {

    private final RunScheduler runScheduler;
    private final RetryPolicy retryPolicy;

    public JobStateMachine(RunScheduler runScheduler, RetryPolicy retryPolicy) {
        this.runScheduler = Objects.requireNonNull(runScheduler, "runScheduler must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    /**
     * Resets the retry counter. Recurring jobs are rescheduled from {@code completedAt}, one-shot jobs are left without a next run.
     */
    public JobTransition onSuccess(Job job, Instant completedAt) {
        Instant nextRunAt = job.isOneShot()
                ? null
                : runScheduler.computeNextRun(job.getSchedule(), completedAt).orElse(null);
        return new JobTransition(JobStatus.ACTIVE, nextRunAt, 0, ExecutionOutcome.SUCCESS, job.getRetryCounter() + 1);
    }

    /**
     * Schedules a backoff retry while retries remain, otherwise dead-letters the job.
     */
    public JobTransition onFailure(Job job, Instant completedAt) {
        int retryCounter = job.getRetryCounter() + 1;
        if (retryCounter > job.getMaxRetries()) {
            return new JobTransition(JobStatus.DEAD_LETTER, null, retryCounter, ExecutionOutcome.DEAD_LETTER, retryCounter);
        }
        Instant nextRunAt = completedAt.plus(retryPolicy.backoff(job.getBackoffBaseSeconds(), retryCounter));
        return new JobTransition(JobStatus.ACTIVE, nextRunAt, retryCounter, ExecutionOutcome.FAILURE, retryCounter);
    }
}
