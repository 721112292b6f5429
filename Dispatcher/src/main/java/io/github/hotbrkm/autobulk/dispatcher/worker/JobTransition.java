package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;

import java.time.Instant;

/**
 * Scheduling state a job moves to after one cycle, and the outcome recorded for that cycle.
 *
 * @param attemptNumber retry counter before the cycle plus one
 */
public record JobTransition(JobStatus status, Instant nextRunAt, int retryCounter, ExecutionOutcome outcome, int attemptNumber) {
}
