package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.recipient.RecipientResolver;
import io.github.hotbrkm.autobulk.dispatcher.schedule.RunScheduler;
import io.github.hotbrkm.autobulk.dispatcher.send.DispatchGateway;
import io.github.hotbrkm.autobulk.dispatcher.send.RecipientDispatcher;
import io.github.hotbrkm.autobulk.dispatcher.send.TemplateRenderer;
import io.github.hotbrkm.autobulk.dispatcher.store.ExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import lombok.experimental.UtilityClass;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.Objects;

/**
 * Factory dedicated to assembling {@link DispatchWorker}.
 */
@UtilityClass
public class DispatchWorkerFactory {

    /**
     * Collaborators the worker needs from the surrounding application.
     */
    public record Components(JobStore jobStore,
                             ExecutionLog executionLog,
                             RunScheduler runScheduler,
                             RecipientResolver recipientResolver,
                             TemplateRenderer templateRenderer,
                             DispatchGateway dispatchGateway,
                             TransactionOperations transactionOperations,
                             Clock clock) {

        public Components {
            Objects.requireNonNull(jobStore, "jobStore must not be null");
            Objects.requireNonNull(executionLog, "executionLog must not be null");
            Objects.requireNonNull(runScheduler, "runScheduler must not be null");
            Objects.requireNonNull(recipientResolver, "recipientResolver must not be null");
            Objects.requireNonNull(templateRenderer, "templateRenderer must not be null");
            Objects.requireNonNull(dispatchGateway, "dispatchGateway must not be null");
            Objects.requireNonNull(transactionOperations, "transactionOperations must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
        }
    }

    public static DispatchWorker create(Components components, WorkerRuntimeOptions options) {
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(options, "options must not be null");

        WorkerExecutors workerExecutors = new WorkerExecutors(options.recipientParallelism());
        RecipientDispatcher recipientDispatcher = new RecipientDispatcher(components.templateRenderer(),
                components.dispatchGateway(), workerExecutors.recipientExecutor(), options.recipientTimeoutMs());
        JobStateMachine jobStateMachine = new JobStateMachine(components.runScheduler(),
                new RetryPolicy(options.maxBackoffSeconds(), options.jitterPercent()));
        JobExecutionProcessor processor = new JobExecutionProcessor(components.jobStore(), components.executionLog(),
                components.recipientResolver(), recipientDispatcher, jobStateMachine,
                new FailureThresholdPolicy(options.failureThresholdPercent()), components.transactionOperations(),
                components.clock());
        StaleClaimRecovery recovery = new StaleClaimRecovery(components.jobStore(), components.executionLog());

        return new DispatchWorker(components.jobStore(), processor, recovery, workerExecutors, components.clock(), options);
    }
}
