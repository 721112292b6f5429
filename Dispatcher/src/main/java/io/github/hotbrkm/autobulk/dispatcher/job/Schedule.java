package io.github.hotbrkm.autobulk.dispatcher.job;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Recurrence rule of a job.
 * <p>
 * One-shot kinds carry {@code runAt} (the creation time for {@link ScheduleKind#IMMEDIATE}),
 * {@link ScheduleKind#RECURRING} carries a 5-field cron expression evaluated in {@code zone}.
 */
public record Schedule(ScheduleKind kind, Instant runAt, String cronExpression, ZoneId zone) {

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    public Schedule {
        Objects.requireNonNull(kind, "kind must not be null");
        zone = zone != null ? zone : DEFAULT_ZONE;
        if (kind.isOneShot()) {
            cronExpression = null;
        } else {
            runAt = null;
        }
    }

    public static Schedule immediate(Instant createdAt) {
        return new Schedule(ScheduleKind.IMMEDIATE, createdAt, null, DEFAULT_ZONE);
    }

    public static Schedule delayed(Instant runAt) {
        return new Schedule(ScheduleKind.DELAYED, runAt, null, DEFAULT_ZONE);
    }

    public static Schedule recurring(String cronExpression, ZoneId zone) {
        return new Schedule(ScheduleKind.RECURRING, null, cronExpression, zone);
    }

    public boolean isOneShot() {
        return kind.isOneShot();
    }
}
