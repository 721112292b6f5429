package io.github.hotbrkm.autobulk.dispatcher.send;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.recipient.Recipient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders and sends a job's message to each recipient on the recipient pool and aggregates the outcomes.
 * <p>
 * All recipients share one deadline. Recipients still running when it passes are cancelled and counted as failed.
 */
@Slf4j
public class RecipientDispatcher {

    private final TemplateRenderer templateRenderer;
    private final DispatchGateway dispatchGateway;
    private final ExecutorService recipientExecutor;
    private final long recipientTimeoutMs;

    public RecipientDispatcher(TemplateRenderer templateRenderer, DispatchGateway dispatchGateway,
                               ExecutorService recipientExecutor, long recipientTimeoutMs) {
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer must not be null");
        this.dispatchGateway = Objects.requireNonNull(dispatchGateway, "dispatchGateway must not be null");
        this.recipientExecutor = Objects.requireNonNull(recipientExecutor, "recipientExecutor must not be null");
        this.recipientTimeoutMs = Math.max(1L, recipientTimeoutMs);
    }

    /**
     * Dispatches to every recipient and waits for all of them or the deadline.
     *
     * @param context extra template variables shared by all recipients (recipient attributes take precedence)
     */
    public DispatchSummary dispatch(Job job, List<Recipient> recipients, Map<String, String> context) {
        if (recipients == null || recipients.isEmpty()) {
            return DispatchSummary.empty();
        }

        List<Future<DeliveryOutcome>> futures = new ArrayList<>(recipients.size());
        for (Recipient recipient : recipients) {
            try {
                futures.add(recipientExecutor.submit(() -> sendOne(job, recipient, context)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(recipientTimeoutMs);
        int succeeded = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < recipients.size(); i++) {
            Recipient recipient = recipients.get(i);
            DeliveryOutcome outcome = awaitOutcome(futures.get(i), deadline);
            if (outcome.isDelivered()) {
                succeeded++;
            } else {
                failed++;
                errors.add(recipient.email() + ": " + outcome.status() + " " + outcome.reason());
            }
        }

        log.info("Job [{}] dispatched to {} recipients ({} succeeded, {} failed)",
                job.getId(), recipients.size(), succeeded, failed);
        return new DispatchSummary(recipients.size(), succeeded, failed, errors);
    }

    private DeliveryOutcome sendOne(Job job, Recipient recipient, Map<String, String> context) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (context != null) {
            variables.putAll(context);
        }
        variables.putAll(recipient.attributes());
        variables.putIfAbsent("email", recipient.email());

        RenderedMessage message;
        try {
            message = templateRenderer.render(job.getTemplateRef(), variables);
        } catch (TemplateException e) {
            log.warn("Job [{}] template '{}' failed for {}: {}", job.getId(), job.getTemplateRef(), recipient.email(), e.getMessage());
            return DeliveryOutcome.rejected("Template error: " + e.getMessage());
        }

        try {
            DeliveryOutcome outcome = dispatchGateway.send(message, recipient);
            return outcome != null ? outcome : DeliveryOutcome.transientError("Gateway returned no outcome");
        } catch (RuntimeException e) {
            log.warn("Job [{}] gateway error for {}", job.getId(), recipient.email(), e);
            return DeliveryOutcome.transientError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private DeliveryOutcome awaitOutcome(Future<DeliveryOutcome> future, long deadlineNanos) {
        if (future == null) {
            return DeliveryOutcome.transientError("Recipient pool rejected the task");
        }
        long remaining = deadlineNanos - System.nanoTime();
        try {
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return DeliveryOutcome.transientError("Timed out after " + recipientTimeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeliveryOutcome.transientError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return DeliveryOutcome.transientError("Interrupted while waiting for delivery");
        }
    }
}
