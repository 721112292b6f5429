package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Set of normalized runtime options for the dispatch worker.
 * <p>
 * The lease always outlasts the recipient timeout by {@link #LEASE_MARGIN_MS}, so a cycle that dispatches slowly
 * keeps its claim until it records the result.
 */
@Slf4j
public record WorkerRuntimeOptions(String workerId,
                                   long pollIntervalMs,
                                   int batchLimit,
                                   long leaseTimeoutMs,
                                   int recipientParallelism,
                                   long recipientTimeoutMs,
                                   int failureThresholdPercent,
                                   long maxBackoffSeconds,
                                   int jitterPercent) {

    public static final long LEASE_MARGIN_MS = 30_000L;

    /**
     * Calculates runtime options from the bound properties.
     */
    public static WorkerRuntimeOptions fromProperties(DispatcherProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        DispatcherProperties.Worker worker = properties.getWorker();
        DispatcherProperties.Retry retry = properties.getRetry();
        return of(worker.getWorkerId(),
                worker.resolvePollIntervalMs(),
                worker.resolveBatchLimit(),
                worker.resolveLeaseTimeoutMs(),
                worker.resolveRecipientParallelism(),
                worker.resolveRecipientTimeoutMs(),
                worker.resolveFailureThresholdPercent(),
                retry.resolveMaxBackoffSeconds(),
                retry.resolveJitterPercent());
    }

    /**
     * Normalizes explicit values into an executable form.
     */
    public static WorkerRuntimeOptions of(String workerId, long pollIntervalMs, int batchLimit, long leaseTimeoutMs,
                                          int recipientParallelism, long recipientTimeoutMs, int failureThresholdPercent,
                                          long maxBackoffSeconds, int jitterPercent) {
        String normalizedWorkerId = workerId == null || workerId.isBlank() ? WorkerIdentity.defaultWorkerId() : workerId.trim();
        long normalizedRecipientTimeoutMs = Math.max(1L, recipientTimeoutMs);
        return new WorkerRuntimeOptions(
                normalizedWorkerId,
                Math.max(10L, pollIntervalMs),
                Math.max(1, batchLimit),
                resolveLeaseTimeoutMs(leaseTimeoutMs, normalizedRecipientTimeoutMs),
                Math.max(1, recipientParallelism),
                normalizedRecipientTimeoutMs,
                Math.min(100, Math.max(0, failureThresholdPercent)),
                Math.max(0L, maxBackoffSeconds),
                Math.min(100, Math.max(0, jitterPercent))
        );
    }

    private static long resolveLeaseTimeoutMs(long leaseTimeoutMs, long recipientTimeoutMs) {
        long minimum = Math.max(1_000L, recipientTimeoutMs + LEASE_MARGIN_MS);
        if (leaseTimeoutMs < minimum) {
            log.warn("Lease timeout {} ms is shorter than recipient timeout {} ms plus {} ms margin; using {} ms",
                    leaseTimeoutMs, recipientTimeoutMs, LEASE_MARGIN_MS, minimum);
            return minimum;
        }
        return leaseTimeoutMs;
    }

    /**
     * Default options under an explicit worker id.
     */
    public static WorkerRuntimeOptions defaults(String workerId) {
        return of(workerId,
                DispatcherProperties.Worker.DEFAULT_POLL_INTERVAL_MS,
                DispatcherProperties.Worker.DEFAULT_BATCH_LIMIT,
                DispatcherProperties.Worker.DEFAULT_LEASE_TIMEOUT_MS,
                DispatcherProperties.Worker.DEFAULT_RECIPIENT_PARALLELISM,
                DispatcherProperties.Worker.DEFAULT_RECIPIENT_TIMEOUT_MS,
                0, 0L, 0);
    }
}
