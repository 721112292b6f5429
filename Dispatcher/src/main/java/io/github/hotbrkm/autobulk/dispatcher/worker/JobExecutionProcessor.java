package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.Execution;
import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.recipient.Recipient;
import io.github.hotbrkm.autobulk.dispatcher.recipient.RecipientResolver;
import io.github.hotbrkm.autobulk.dispatcher.recipient.ResolutionException;
import io.github.hotbrkm.autobulk.dispatcher.send.DispatchSummary;
import io.github.hotbrkm.autobulk.dispatcher.send.RecipientDispatcher;
import io.github.hotbrkm.autobulk.dispatcher.store.ExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import io.github.hotbrkm.autobulk.dispatcher.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one cycle of a claimed job: resolve recipients, dispatch, decide the verdict, then record the execution
 * and the new scheduling state in a single transaction.
 */
@Slf4j
public class JobExecutionProcessor {

    private final JobStore jobStore;
    private final ExecutionLog executionLog;
    private final RecipientResolver recipientResolver;
    private final RecipientDispatcher recipientDispatcher;
    private final JobStateMachine jobStateMachine;
    private final FailureThresholdPolicy failureThresholdPolicy;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    public JobExecutionProcessor(JobStore jobStore, ExecutionLog executionLog, RecipientResolver recipientResolver,
                                 RecipientDispatcher recipientDispatcher, JobStateMachine jobStateMachine,
                                 FailureThresholdPolicy failureThresholdPolicy, TransactionOperations transactionOperations,
                                 Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.recipientResolver = Objects.requireNonNull(recipientResolver, "recipientResolver must not be null");
        this.recipientDispatcher = Objects.requireNonNull(recipientDispatcher, "recipientDispatcher must not be null");
        this.jobStateMachine = Objects.requireNonNull(jobStateMachine, "jobStateMachine must not be null");
        this.failureThresholdPolicy = Objects.requireNonNull(failureThresholdPolicy, "failureThresholdPolicy must not be null");
        this.transactionOperations = Objects.requireNonNull(transactionOperations, "transactionOperations must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Processes one job cycle.
     *
     * @return the execution recorded for the cycle, or empty if the job's lease was taken over by another worker
     * meanwhile, in which case nothing is committed
     * @throws StoreException if the execution or the job update could not be persisted; nothing is committed then
     */
    public Optional<Execution> process(Job job) {
        Instant attemptedAt = clock.instant();
        int attemptNumber = job.getRetryCounter() + 1;
        log.info("Job [{}] '{}' starting attempt {}", job.getId(), job.getName(), attemptNumber);

        DispatchSummary summary;
        String errorSummary;
        boolean failed;
        try {
            List<Recipient> recipients = recipientResolver.resolve(job);
            summary = recipientDispatcher.dispatch(job, recipients, Map.of(
                    "job_id", job.getId(),
                    "attempt", String.valueOf(attemptNumber)));
            errorSummary = summary.errorSummary();
            failed = failureThresholdPolicy.isFailure(summary);
        } catch (ResolutionException e) {
            log.warn("Job [{}] recipient resolution failed: {}", job.getId(), e.getMessage());
            summary = DispatchSummary.empty();
            errorSummary = "Recipient resolution failed: " + e.getMessage();
            failed = true;
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Job [{}] dispatch cycle failed unexpectedly", job.getId(), e);
            summary = DispatchSummary.empty();
            errorSummary = "Dispatch cycle failed: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            failed = true;
        }

        Instant completedAt = clock.instant();
        JobTransition transition = failed
                ? jobStateMachine.onFailure(job, completedAt)
                : jobStateMachine.onSuccess(job, completedAt);

        Execution execution = Execution.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .attemptedAt(attemptedAt)
                .completedAt(completedAt)
                .outcome(transition.outcome())
                .recipientsAttempted(summary.attempted())
                .recipientsSucceeded(summary.succeeded())
                .recipientsFailed(summary.failed())
                .errorSummary(errorSummary)
                .attemptNumber(transition.attemptNumber())
                .build();

        String workerId = job.getClaimedBy();
        CycleRecord cycleRecord = transactionOperations.execute(status -> {
            executionLog.append(execution);
            if (jobStore.updateAfterExecution(job.getId(), workerId, transition.status(), transition.nextRunAt(),
                    transition.retryCounter(), completedAt)) {
                return CycleRecord.APPLIED;
            }
            if (!isStillLeasedBy(job.getId(), workerId)) {
                status.setRollbackOnly();
                return CycleRecord.LEASE_LOST;
            }
            if (workerId != null) {
                jobStore.releaseClaim(job.getId(), workerId);
            }
            return CycleRecord.CANCELLED;
        });

        if (cycleRecord == CycleRecord.LEASE_LOST) {
            log.warn("Job [{}] lease of worker [{}] was taken over during execution; outcome {} discarded",
                    job.getId(), workerId, transition.outcome());
            return Optional.empty();
        }
        logTransition(job, transition, summary, cycleRecord == CycleRecord.APPLIED);
        return Optional.of(execution);
    }

    private boolean isStillLeasedBy(String jobId, String workerId) {
        return jobStore.findById(jobId)
                .map(current -> Objects.equals(workerId, current.getClaimedBy()))
                .orElse(false);
    }

    private void logTransition(Job job, JobTransition transition, DispatchSummary summary, boolean updated) {
        if (!updated) {
            log.info("Job [{}] was cancelled during execution; outcome {} recorded without rescheduling",
                    job.getId(), transition.outcome());
            return;
        }
        if (transition.outcome() == ExecutionOutcome.SUCCESS) {
            log.info("Job [{}] succeeded ({}/{} recipients). Next run: {}",
                    job.getId(), summary.succeeded(), summary.attempted(), transition.nextRunAt());
        } else if (transition.outcome() == ExecutionOutcome.FAILURE) {
            log.warn("Job [{}] failed ({} of {} recipients failed). Retry {}/{} at {}",
                    job.getId(), summary.failed(), summary.attempted(), transition.retryCounter(), job.getMaxRetries(),
                    transition.nextRunAt());
        } else {
            log.error("Job [{}] moved to dead-letter after {} consecutive failures", job.getId(), transition.retryCounter());
        }
    }

    private enum CycleRecord {
        APPLIED,
        CANCELLED,
        LEASE_LOST
    }
}
