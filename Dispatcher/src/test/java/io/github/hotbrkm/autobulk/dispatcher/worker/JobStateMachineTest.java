package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.job.ExecutionOutcome;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.JobStatus;
import io.github.hotbrkm.autobulk.dispatcher.job.TestJobs;
import io.github.hotbrkm.autobulk.dispatcher.schedule.CronRunScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobStateMachine transition test")
class JobStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private final JobStateMachine stateMachine = new JobStateMachine(new CronRunScheduler(), RetryPolicy.uncapped());

    @Test
    @DisplayName("First failure schedules a retry after the base interval")
    void firstFailure_schedulesBaseBackoff() {
        Job job = TestJobs.delayedJob(NOW).backoffBaseSeconds(60).maxRetries(3).build();

        JobTransition transition = stateMachine.onFailure(job, NOW);

        assertThat(transition.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(transition.retryCounter()).isEqualTo(1);
        assertThat(transition.nextRunAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(transition.outcome()).isEqualTo(ExecutionOutcome.FAILURE);
        assertThat(transition.attemptNumber()).isEqualTo(1);
    }

    @Test
    @DisplayName("Second consecutive failure doubles the backoff")
    void secondFailure_doublesBackoff() {
        Job job = TestJobs.delayedJob(NOW).backoffBaseSeconds(60).maxRetries(3).retryCounter(1).build();

        JobTransition transition = stateMachine.onFailure(job, NOW);

        assertThat(transition.retryCounter()).isEqualTo(2);
        assertThat(transition.nextRunAt()).isEqualTo(NOW.plusSeconds(120));
        assertThat(transition.attemptNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("Failure beyond the retry budget dead-letters the job")
    void exhaustedBudget_deadLetters() {
        Job job = TestJobs.delayedJob(NOW).maxRetries(3).retryCounter(3).build();

        JobTransition transition = stateMachine.onFailure(job, NOW);

        assertThat(transition.status()).isEqualTo(JobStatus.DEAD_LETTER);
        assertThat(transition.nextRunAt()).isNull();
        assertThat(transition.retryCounter()).isEqualTo(4);
        assertThat(transition.outcome()).isEqualTo(ExecutionOutcome.DEAD_LETTER);
    }

    @Test
    @DisplayName("Zero retry budget dead-letters on the first failure")
    void zeroBudget_deadLettersImmediately() {
        Job job = TestJobs.delayedJob(NOW).maxRetries(0).build();

        assertThat(stateMachine.onFailure(job, NOW).status()).isEqualTo(JobStatus.DEAD_LETTER);
    }

    @Test
    @DisplayName("Successful one-shot job stays active without a next run")
    void oneShotSuccess_clearsNextRun() {
        Job job = TestJobs.delayedJob(NOW).retryCounter(2).build();

        JobTransition transition = stateMachine.onSuccess(job, NOW);

        assertThat(transition.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(transition.nextRunAt()).isNull();
        assertThat(transition.retryCounter()).isZero();
        assertThat(transition.outcome()).isEqualTo(ExecutionOutcome.SUCCESS);
        assertThat(transition.attemptNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("Successful recurring job is rescheduled from the completion time")
    void recurringSuccess_reschedulesFromCompletion() {
        Instant staleNextRun = NOW.minusSeconds(3 * 3600);
        Job job = TestJobs.recurringJob("0 * * * *", staleNextRun).retryCounter(1).build();

        JobTransition transition = stateMachine.onSuccess(job, NOW.plusSeconds(90));

        assertThat(transition.nextRunAt()).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
        assertThat(transition.retryCounter()).isZero();
    }
}
