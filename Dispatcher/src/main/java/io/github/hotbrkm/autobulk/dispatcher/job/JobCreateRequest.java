package io.github.hotbrkm.autobulk.dispatcher.job;

import lombok.Builder;

import java.time.Instant;

/**
 * Input of {@link JobService#create}. Nullable retry settings fall back to the configured defaults.
 *
 * @param runAt          required for {@link ScheduleKind#DELAYED}, ignored otherwise
 * @param cronExpression required for {@link ScheduleKind#RECURRING}, ignored otherwise
 * @param timeZone       IANA zone id the cron expression is evaluated in
 */
@Builder
public record JobCreateRequest(String name,
                               String templateRef,
                               RecipientSpec recipientSpec,
                               ScheduleKind scheduleKind,
                               Instant runAt,
                               String cronExpression,
                               String timeZone,
                               Integer maxRetries,
                               Long backoffBaseSeconds) {
}
