package io.github.hotbrkm.autobulk.dispatcher.job;

/**
 * Outcome recorded on an execution row. Matches the transition the worker applied to the job.
 */
public enum ExecutionOutcome {
    SUCCESS,
    FAILURE,
    DEAD_LETTER
}
