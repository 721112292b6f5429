package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.Execution;
import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;
import io.github.hotbrkm.autobulk.dispatcher.store.ExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Start-up reconciliation of state left behind by a crashed worker.
 * <ul>
 *   <li>expired leases are released so the jobs become claimable again;</li>
 *   <li>active jobs whose latest execution dead-lettered them are moved to {@link JobStatus#DEAD_LETTER};</li>
 *   <li>one-shot jobs whose scheduled run already succeeded lose their next run.</li>
 * </ul>
 * Jobs under a live lease are left alone.
 */
@Slf4j
class StaleClaimRecovery {

    private final JobStore jobStore;
    private final ExecutionLog executionLog;

    StaleClaimRecovery(JobStore jobStore, ExecutionLog executionLog) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
    }

    /**
     * @return number of released leases plus reconciled jobs
     */
    int recover(Instant now) {
        int released = jobStore.releaseExpiredClaims(now);
        if (released > 0) {
            log.warn("Released {} expired job claims", released);
        }

        int reconciled = 0;
        for (Job job : jobStore.findByStatus(JobStatus.ACTIVE)) {
            if (job.getClaimedBy() != null) {
                continue;
            }
            Optional<Execution> latest = executionLog.findLatest(job.getId());
            if (latest.isEmpty()) {
                continue;
            }
            if (reconcile(job, latest.get(), now)) {
                reconciled++;
            }
        }
        if (reconciled > 0) {
            log.warn("Reconciled {} jobs left inconsistent by an interrupted cycle", reconciled);
        }
        return released + reconciled;
    }

    private boolean reconcile(Job job, Execution latest, Instant now) {
        if (latest.outcome() == ExecutionOutcome.DEAD_LETTER) {
            log.error("Job [{}] is active but its latest execution dead-lettered it; marking dead-letter", job.getId());
            return jobStore.updateAfterExecution(job.getId(), null, JobStatus.DEAD_LETTER, null, job.getRetryCounter(), now);
        }
        if (job.isOneShot() && job.getNextRunAt() != null && latest.outcome() == ExecutionOutcome.SUCCESS
                && !latest.attemptedAt().isBefore(job.getNextRunAt())) {
            log.warn("One-shot job [{}] already succeeded at {}; clearing its next run", job.getId(), latest.attemptedAt());
            return jobStore.updateAfterExecution(job.getId(), null, JobStatus.ACTIVE, null, 0, now);
        }
        return false;
    }
}
