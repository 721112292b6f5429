package io.github.hotbrkm.autobulk.dispatcher.schedule;

import io.github.hotbrkm.autobulk.dispatcher.job.Schedule;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link RunScheduler} backed by {@link CronSchedule}.
 * Parsed expressions are cached since parsing is deterministic.
 */
@Slf4j
public class CronRunScheduler implements RunScheduler {

    private final Map<String, CronSchedule> parsedExpressions = new ConcurrentHashMap<>();

    @Override
    public Optional<Instant> computeNextRun(Schedule schedule, Instant after) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(after, "after must not be null");

        switch (schedule.kind()) {
            case IMMEDIATE, DELAYED -> {
                Instant runAt = schedule.runAt();
                if (runAt == null || runAt.isBefore(after)) {
                    return Optional.empty();
                }
                return Optional.of(runAt);
            }
            case RECURRING -> {
                CronSchedule cron;
                try {
                    cron = cronOf(schedule.cronExpression());
                } catch (ScheduleParseException e) {
                    // Should have been rejected at creation; treat the rule as exhausted.
                    log.error("Unable to evaluate stored cron expression '{}'", schedule.cronExpression(), e);
                    return Optional.empty();
                }
                return cron.next(after.atZone(schedule.zone())).map(ZonedDateTime::toInstant);
            }
            default -> throw new IllegalStateException("Unsupported schedule kind: " + schedule.kind());
        }
    }

    @Override
    public Optional<Instant> computeFirstRun(Schedule schedule, Instant createdAt) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");

        return switch (schedule.kind()) {
            case IMMEDIATE -> Optional.of(createdAt);
            // A delayed job whose run time already passed runs on the next poll.
            case DELAYED -> Optional.ofNullable(schedule.runAt());
            case RECURRING -> computeNextRun(schedule, createdAt);
        };
    }

    @Override
    public void validate(Schedule schedule) {
        if (schedule == null) {
            throw new ScheduleParseException("Schedule must not be null");
        }
        switch (schedule.kind()) {
            case IMMEDIATE -> {
                // run time is the creation time
            }
            case DELAYED -> {
                if (schedule.runAt() == null) {
                    throw new ScheduleParseException("Delayed jobs must define run_at");
                }
            }
            case RECURRING -> {
                if (schedule.cronExpression() == null || schedule.cronExpression().isBlank()) {
                    throw new ScheduleParseException("Recurring jobs require a cron expression");
                }
                cronOf(schedule.cronExpression());
            }
        }
    }

    private CronSchedule cronOf(String expression) {
        if (expression == null) {
            throw new ScheduleParseException("Cron expression must not be blank");
        }
        CronSchedule cached = parsedExpressions.get(expression);
        if (cached != null) {
            return cached;
        }
        CronSchedule parsed = CronSchedule.parse(expression);
        parsedExpressions.putIfAbsent(expression, parsed);
        return parsed;
    }
}
