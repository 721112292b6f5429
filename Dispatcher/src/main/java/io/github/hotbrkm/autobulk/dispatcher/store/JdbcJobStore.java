package io.github.hotbrkm.autobulk.dispatcher.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;
import io.github.hotbrkm.autobulk.dispatcher.job.Schedule;
import io.github.hotbrkm.autobulk.dispatcher.job.ScheduleKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import static io.github.hotbrkm.autobulk.dispatcher.store.JdbcTimestamps.read;
import static io.github.hotbrkm.autobulk.dispatcher.store.JdbcTimestamps.toColumn;

/**
 * {@link JobStore} on plain JDBC. Claims use conditional updates rather than row locks, so any database that
 * reports affected row counts can host several pollers.
 */
@Slf4j
public class JdbcJobStore implements JobStore {

    private static final String COLUMNS = "id, name, template_ref, recipient_spec, schedule_kind, run_at, cron_expr, "
            + "time_zone, next_run_at, status, retry_counter, max_retries, backoff_base_seconds, created_at, updated_at, "
            + "claimed_by, claimed_at, claim_expires_at";

    private static final String INSERT = "INSERT INTO jobs (" + COLUMNS + ") VALUES (:id, :name, :templateRef, "
            + ":recipientSpec, :scheduleKind, :runAt, :cronExpr, :timeZone, :nextRunAt, :status, :retryCounter, "
            + ":maxRetries, :backoffBaseSeconds, :createdAt, :updatedAt, NULL, NULL, NULL)";

    private static final String DUE_CONDITION = "status = 'ACTIVE' AND next_run_at IS NOT NULL AND next_run_at <= :now";
    private static final String UNCLAIMED_CONDITION = "(claimed_by IS NULL OR claim_expires_at < :now)";

    private static final String SELECT_DUE = "SELECT " + COLUMNS + " FROM jobs WHERE " + DUE_CONDITION
            + " ORDER BY next_run_at ASC, id ASC LIMIT :limit";

    private static final String SELECT_CLAIMABLE = "SELECT " + COLUMNS + " FROM jobs WHERE " + DUE_CONDITION
            + " AND " + UNCLAIMED_CONDITION + " ORDER BY next_run_at ASC, id ASC LIMIT :limit";

    private static final String CLAIM = "UPDATE jobs SET claimed_by = :workerId, claimed_at = :now, "
            + "claim_expires_at = :expiresAt WHERE id = :id AND " + DUE_CONDITION + " AND " + UNCLAIMED_CONDITION;

    private static final String UPDATE_AFTER_EXECUTION = "UPDATE jobs SET status = :status, next_run_at = :nextRunAt, "
            + "retry_counter = :retryCounter, updated_at = :now, claimed_by = NULL, claimed_at = NULL, "
            + "claim_expires_at = NULL WHERE id = :id AND status = 'ACTIVE'";

    private static final String UPDATE_CLAIMED_AFTER_EXECUTION = UPDATE_AFTER_EXECUTION + " AND claimed_by = :workerId";

    private static final String UPDATE_UNCLAIMED_AFTER_EXECUTION = UPDATE_AFTER_EXECUTION + " AND claimed_by IS NULL";

    private static final String CANCEL = "UPDATE jobs SET status = 'CANCELLED', next_run_at = NULL, updated_at = :now "
            + "WHERE id = :id AND status = 'ACTIVE'";

    private static final String RELEASE_CLAIM = "UPDATE jobs SET claimed_by = NULL, claimed_at = NULL, "
            + "claim_expires_at = NULL WHERE id = :id AND claimed_by = :workerId";

    private static final String RELEASE_EXPIRED_CLAIMS = "UPDATE jobs SET claimed_by = NULL, claimed_at = NULL, "
            + "claim_expires_at = NULL WHERE claimed_by IS NOT NULL AND claim_expires_at < :now";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RecipientSpecCodec recipientSpecCodec;
    private final RowMapper<Job> rowMapper = this::mapRow;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.recipientSpecCodec = new RecipientSpecCodec(objectMapper);
    }

    @Override
    public void insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Schedule schedule = job.getSchedule();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", job.getId())
                .addValue("name", job.getName())
                .addValue("templateRef", job.getTemplateRef())
                .addValue("recipientSpec", recipientSpecCodec.encode(job.getRecipientSpec()))
                .addValue("scheduleKind", schedule.kind().name())
                .addValue("runAt", toColumn(schedule.runAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("cronExpr", schedule.cronExpression(), Types.VARCHAR)
                .addValue("timeZone", schedule.zone().getId())
                .addValue("nextRunAt", toColumn(job.getNextRunAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("status", job.getStatus().name())
                .addValue("retryCounter", job.getRetryCounter())
                .addValue("maxRetries", job.getMaxRetries())
                .addValue("backoffBaseSeconds", job.getBackoffBaseSeconds())
                .addValue("createdAt", toColumn(job.getCreatedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("updatedAt", toColumn(job.getUpdatedAt()), Types.TIMESTAMP_WITH_TIMEZONE);
        execute("insert job " + job.getId(), () -> jdbcTemplate.update(INSERT, params));
    }

    @Override
    public Optional<Job> findById(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", jobId);
        List<Job> jobs = execute("find job " + jobId,
                () -> jdbcTemplate.query("SELECT " + COLUMNS + " FROM jobs WHERE id = :id", params, rowMapper));
        return jobs.stream().findFirst();
    }

    @Override
    public List<Job> findAll() {
        return execute("list jobs",
                () -> jdbcTemplate.query("SELECT " + COLUMNS + " FROM jobs ORDER BY created_at DESC, id ASC", rowMapper));
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource("status", status.name());
        return execute("list " + status + " jobs", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM jobs WHERE status = :status ORDER BY created_at DESC, id ASC", params, rowMapper));
    }

    @Override
    public List<Job> selectDue(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("limit", Math.max(0, limit));
        return execute("select due jobs", () -> jdbcTemplate.query(SELECT_DUE, params, rowMapper));
    }

    @Override
    public List<Job> claimDue(Instant now, int limit, String workerId, Duration leaseDuration) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(leaseDuration, "leaseDuration must not be null");
        MapSqlParameterSource selectParams = new MapSqlParameterSource()
                .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("limit", Math.max(0, limit));
        List<Job> candidates = execute("select claimable jobs",
                () -> jdbcTemplate.query(SELECT_CLAIMABLE, selectParams, rowMapper));

        Instant expiresAt = now.plus(leaseDuration);
        List<Job> claimed = new ArrayList<>(candidates.size());
        for (Job candidate : candidates) {
            MapSqlParameterSource claimParams = new MapSqlParameterSource()
                    .addValue("id", candidate.getId())
                    .addValue("workerId", workerId)
                    .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE)
                    .addValue("expiresAt", toColumn(expiresAt), Types.TIMESTAMP_WITH_TIMEZONE);
            int updated = execute("claim job " + candidate.getId(), () -> jdbcTemplate.update(CLAIM, claimParams));
            if (updated == 1) {
                claimed.add(candidate.toBuilder()
                        .claimedBy(workerId)
                        .claimedAt(now)
                        .claimExpiresAt(expiresAt)
                        .build());
            } else {
                log.debug("Job {} was claimed by another worker, skipping", candidate.getId());
            }
        }
        return claimed;
    }

    @Override
    public boolean updateAfterExecution(String jobId, String workerId, JobStatus status, Instant nextRunAt,
                                        int retryCounter, Instant now) {
        Objects.requireNonNull(status, "status must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("workerId", workerId)
                .addValue("status", status.name())
                .addValue("nextRunAt", toColumn(nextRunAt), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("retryCounter", retryCounter)
                .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE);
        int updated = execute("update job " + jobId, () -> jdbcTemplate.update(
                workerId == null ? UPDATE_UNCLAIMED_AFTER_EXECUTION : UPDATE_CLAIMED_AFTER_EXECUTION, params));
        return updated == 1;
    }

    @Override
    public boolean cancel(String jobId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE);
        return execute("cancel job " + jobId, () -> jdbcTemplate.update(CANCEL, params)) == 1;
    }

    @Override
    public void releaseClaim(String jobId, String workerId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("workerId", workerId);
        execute("release claim on job " + jobId, () -> jdbcTemplate.update(RELEASE_CLAIM, params));
    }

    @Override
    public int releaseExpiredClaims(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("now", toColumn(now), Types.TIMESTAMP_WITH_TIMEZONE);
        return execute("release expired claims", () -> jdbcTemplate.update(RELEASE_EXPIRED_CLAIMS, params));
    }

    private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
        ScheduleKind kind = ScheduleKind.valueOf(rs.getString("schedule_kind"));
        Schedule schedule = new Schedule(kind, read(rs, "run_at"), rs.getString("cron_expr"),
                ZoneId.of(rs.getString("time_zone")));
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .templateRef(rs.getString("template_ref"))
                .recipientSpec(recipientSpecCodec.decode(rs.getString("recipient_spec")))
                .schedule(schedule)
                .nextRunAt(read(rs, "next_run_at"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .retryCounter(rs.getInt("retry_counter"))
                .maxRetries(rs.getInt("max_retries"))
                .backoffBaseSeconds(rs.getLong("backoff_base_seconds"))
                .createdAt(read(rs, "created_at"))
                .updatedAt(read(rs, "updated_at"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(read(rs, "claimed_at"))
                .claimExpiresAt(read(rs, "claim_expires_at"))
                .build();
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }
}
