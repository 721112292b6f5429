package io.github.hotbrkm.autobulk.dispatcher.job;

/**
 * Scheduling status of a job row.
 * <p>
 * Only {@link #ACTIVE} jobs are ever selected by the poller. A finished one-shot job stays
 * {@code ACTIVE} with a null {@code next_run_at} so its history reads naturally.
 */
public enum JobStatus {
    ACTIVE,
    CANCELLED,
    DEAD_LETTER;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
