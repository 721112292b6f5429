package io.github.hotbrkm.autobulk.dispatcher.job;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A schedulable unit of bulk dispatch, as persisted in the {@code jobs} table.
 * <p>
 * Instances are immutable snapshots of a row; state changes go through the job store.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class Job {

    private final String id;
    private final String name;
    private final String templateRef;
    private final RecipientSpec recipientSpec;
    private final Schedule schedule;
    private final Instant nextRunAt;
    private final JobStatus status;
    private final int retryCounter;
    private final int maxRetries;
    private final long backoffBaseSeconds;
    private final Instant createdAt;
    private final Instant updatedAt;

    // lease held by the worker currently processing the job
    private final String claimedBy;
    private final Instant claimedAt;
    private final Instant claimExpiresAt;

    /**
     * Returns whether the poller may pick this job at {@code now}.
     */
    public boolean isDue(Instant now) {
        return status == JobStatus.ACTIVE && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public boolean isOneShot() {
        return schedule.isOneShot();
    }
}
