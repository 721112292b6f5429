package io.github.hotbrkm.autobulk.dispatcher.store;

import io.github.hotbrkm.autobulk.dispatcher.job.Execution;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of dispatch cycles. Rows are never updated or deleted.
 */
public interface ExecutionLog {

    void append(Execution execution);

    /**
     * Most recent executions of a job, newest first.
     */
    List<Execution> findByJobId(String jobId, int limit);

    Optional<Execution> findLatest(String jobId);
}
