package io.github.hotbrkm.autobulk.dispatcher.store;

import io.github.hotbrkm.autobulk.dispatcher.job.Execution;
import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.github.hotbrkm.autobulk.dispatcher.store.JdbcTimestamps.read;
import static io.github.hotbrkm.autobulk.dispatcher.store.JdbcTimestamps.toColumn;

public class JdbcExecutionLog implements ExecutionLog {

    private static final String COLUMNS = "id, job_id, attempted_at, completed_at, outcome, recipients_attempted, "
            + "recipients_succeeded, recipients_failed, error_summary, attempt_number";

    private static final String INSERT = "INSERT INTO executions (" + COLUMNS + ") VALUES (:id, :jobId, :attemptedAt, "
            + ":completedAt, :outcome, :attempted, :succeeded, :failed, :errorSummary, :attemptNumber)";

    private static final String SELECT_BY_JOB = "SELECT " + COLUMNS + " FROM executions WHERE job_id = :jobId "
            + "ORDER BY attempted_at DESC, completed_at DESC LIMIT :limit";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RowMapper<Execution> rowMapper = JdbcExecutionLog::mapRow;

    public JdbcExecutionLog(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    }

    @Override
    public void append(Execution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", execution.id())
                .addValue("jobId", execution.jobId())
                .addValue("attemptedAt", toColumn(execution.attemptedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("completedAt", toColumn(execution.completedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("outcome", execution.outcome().name())
                .addValue("attempted", execution.recipientsAttempted())
                .addValue("succeeded", execution.recipientsSucceeded())
                .addValue("failed", execution.recipientsFailed())
                .addValue("errorSummary", execution.errorSummary(), Types.VARCHAR)
                .addValue("attemptNumber", execution.attemptNumber());
        try {
            jdbcTemplate.update(INSERT, params);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to append execution for job " + execution.jobId(), e);
        }
    }

    @Override
    public List<Execution> findByJobId(String jobId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("limit", Math.max(0, limit));
        try {
            return jdbcTemplate.query(SELECT_BY_JOB, params, rowMapper);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read executions of job " + jobId, e);
        }
    }

    @Override
    public Optional<Execution> findLatest(String jobId) {
        return findByJobId(jobId, 1).stream().findFirst();
    }

    private static Execution mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Execution.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .attemptedAt(read(rs, "attempted_at"))
                .completedAt(read(rs, "completed_at"))
                .outcome(ExecutionOutcome.valueOf(rs.getString("outcome")))
                .recipientsAttempted(rs.getInt("recipients_attempted"))
                .recipientsSucceeded(rs.getInt("recipients_succeeded"))
                .recipientsFailed(rs.getInt("recipients_failed"))
                .errorSummary(rs.getString("error_summary"))
                .attemptNumber(rs.getInt("attempt_number"))
                .build();
    }
}
