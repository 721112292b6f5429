package io.github.hotbrkm.autobulk.dispatcher.schedule;

import io.github.hotbrkm.autobulk.dispatcher.job.Schedule;

import java.time.Instant;
import java.util.Optional;

/**
 * Side-effect-free mapping from a schedule to its next eligible run time.
 * <p>
 * Implementations must be deterministic: the same {@code (schedule, after)} pair always yields the same instant,
 * so a job can be rescheduled safely after a crash.
 */
public interface RunScheduler {

    /**
     * Next run strictly after {@code after} for recurring schedules; for one-shot schedules the fixed run time
     * while it is not before {@code after}. Empty means no further runs.
     */
    Optional<Instant> computeNextRun(Schedule schedule, Instant after);

    /**
     * First eligible run of a newly created job.
     */
    Optional<Instant> computeFirstRun(Schedule schedule, Instant createdAt);

    /**
     * Rejects schedules the runtime computation could not evaluate.
     *
     * @throws ScheduleParseException if the schedule is incomplete or malformed
     */
    void validate(Schedule schedule);
}
