package io.github.hotbrkm.autobulk.dispatcher.job;

import io.github.hotbrkm.autobulk.dispatcher.recipient.EmailAddressUtil;
import io.github.hotbrkm.autobulk.dispatcher.schedule.RunScheduler;
import io.github.hotbrkm.autobulk.dispatcher.schedule.ScheduleParseException;
import io.github.hotbrkm.autobulk.dispatcher.store.ExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Administrative path: creates, lists, inspects and cancels jobs.
 */
@Slf4j
public class JobService {

    public static final int DEFAULT_EXECUTION_LIMIT = 10;

    private final JobStore jobStore;
    private final ExecutionLog executionLog;
    private final RunScheduler runScheduler;
    private final Clock clock;
    private final int defaultMaxRetries;
    private final long defaultBackoffBaseSeconds;
    private final ZoneId defaultZone;

    public JobService(JobStore jobStore, ExecutionLog executionLog, RunScheduler runScheduler, Clock clock,
                      int defaultMaxRetries, long defaultBackoffBaseSeconds, ZoneId defaultZone) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.runScheduler = Objects.requireNonNull(runScheduler, "runScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultMaxRetries = Math.max(0, defaultMaxRetries);
        this.defaultBackoffBaseSeconds = Math.max(1L, defaultBackoffBaseSeconds);
        this.defaultZone = defaultZone != null ? defaultZone : Schedule.DEFAULT_ZONE;
    }

    /**
     * Validates the request and inserts an active job scheduled at its first eligible time.
     *
     * @throws ScheduleParseException   if the schedule is malformed or can never fire
     * @throws IllegalArgumentException if any other field is invalid
     */
    public Job create(JobCreateRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String name = requireText(request.name(), "name");
        String templateRef = requireText(request.templateRef(), "templateRef");
        validateRecipientSpec(request.recipientSpec());

        int maxRetries = request.maxRetries() != null ? request.maxRetries() : defaultMaxRetries;
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        long backoffBaseSeconds = request.backoffBaseSeconds() != null ? request.backoffBaseSeconds() : defaultBackoffBaseSeconds;
        if (backoffBaseSeconds < 1) {
            throw new IllegalArgumentException("backoffBaseSeconds must be >= 1");
        }

        // stored timestamps keep microsecond precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Schedule schedule = buildSchedule(request, now);
        runScheduler.validate(schedule);
        Instant firstRun = runScheduler.computeFirstRun(schedule, now)
                .orElseThrow(() -> new ScheduleParseException("Schedule never fires: " + describe(schedule)));

        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .templateRef(templateRef)
                .recipientSpec(request.recipientSpec())
                .schedule(schedule)
                .nextRunAt(firstRun)
                .status(JobStatus.ACTIVE)
                .retryCounter(0)
                .maxRetries(maxRetries)
                .backoffBaseSeconds(backoffBaseSeconds)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobStore.insert(job);
        log.info("Created job [{}] '{}' ({}), first run at {}", job.getId(), name, schedule.kind(), firstRun);
        return job;
    }

    /**
     * Cancels an active job. Cancelling a cancelled or dead-lettered job changes nothing.
     *
     * @return the job as stored after the call
     * @throws JobNotFoundException if no job has the given id
     */
    public Job cancel(String jobId) {
        Job job = get(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("Job [{}] is already {}; cancel ignored", jobId, job.getStatus());
            return job;
        }
        if (jobStore.cancel(jobId, clock.instant())) {
            log.info("Cancelled job [{}]", jobId);
        }
        return get(jobId);
    }

    /**
     * @throws JobNotFoundException if no job has the given id
     */
    public Job get(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * All jobs, newest first.
     */
    public List<Job> list() {
        return jobStore.findAll();
    }

    public List<Execution> recentExecutions(String jobId) {
        return recentExecutions(jobId, DEFAULT_EXECUTION_LIMIT);
    }

    /**
     * Latest executions of a job, newest first.
     *
     * @throws JobNotFoundException if no job has the given id
     */
    public List<Execution> recentExecutions(String jobId, int limit) {
        get(jobId);
        return executionLog.findByJobId(jobId, limit > 0 ? limit : DEFAULT_EXECUTION_LIMIT);
    }

    private Schedule buildSchedule(JobCreateRequest request, Instant now) {
        ScheduleKind kind = request.scheduleKind();
        if (kind == null) {
            throw new IllegalArgumentException("scheduleKind must not be null");
        }
        return switch (kind) {
            case IMMEDIATE -> Schedule.immediate(now);
            case DELAYED -> {
                if (request.runAt() == null) {
                    throw new ScheduleParseException("Delayed job requires runAt");
                }
                yield Schedule.delayed(request.runAt().truncatedTo(ChronoUnit.MICROS));
            }
            case RECURRING -> Schedule.recurring(request.cronExpression(), parseZone(request.timeZone()));
        };
    }

    private ZoneId parseZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleParseException("Unknown time zone: " + timeZone, e);
        }
    }

    private static void validateRecipientSpec(RecipientSpec recipientSpec) {
        if (recipientSpec == null) {
            throw new IllegalArgumentException("recipientSpec must not be null");
        }
        if (recipientSpec instanceof RecipientSpec.StaticList staticList) {
            if (staticList.addresses().isEmpty()) {
                throw new IllegalArgumentException("Static recipient list must not be empty");
            }
            for (String address : staticList.addresses()) {
                if (!EmailAddressUtil.isValid(address)) {
                    throw new IllegalArgumentException("Invalid recipient address: " + address);
                }
            }
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    private static String describe(Schedule schedule) {
        return schedule.isOneShot() ? schedule.kind() + " at " + schedule.runAt()
                : "'" + schedule.cronExpression() + "' in " + schedule.zone();
    }
}
