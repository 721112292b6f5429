package io.github.hotbrkm.autobulk.dispatcher.worker;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centrally manages the executors used by the worker.
 * <ul>
 *   <li><b>pollExecutor</b>: single thread running the poll loop at a fixed delay, so ticks never overlap.</li>
 *   <li><b>recipientExecutor</b>: fixed pool for per-recipient render and send.</li>
 * </ul>
 */
@Slf4j
final class WorkerExecutors {

    private final ScheduledThreadPoolExecutor pollExecutor;
    private final ExecutorService recipientExecutor;

    WorkerExecutors(int recipientParallelism) {
        this.pollExecutor = new ScheduledThreadPoolExecutor(1, namedThreadFactory("autobulk-poll"));
        this.pollExecutor.setRemoveOnCancelPolicy(true);
        this.recipientExecutor = Executors.newFixedThreadPool(Math.max(1, recipientParallelism),
                namedThreadFactory("autobulk-recipient"));
    }

    ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
        return pollExecutor.scheduleWithFixedDelay(command, initialDelay, delay, unit);
    }

    ExecutorService recipientExecutor() {
        return recipientExecutor;
    }

    /**
     * Shuts down all executors, waiting for the running tick to finish.
     */
    void shutdown() {
        pollExecutor.shutdown();
        try {
            if (!pollExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Poll loop did not stop within 30 seconds; interrupting");
                pollExecutor.shutdownNow();
            }
            recipientExecutor.shutdown();
            if (!recipientExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                recipientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pollExecutor.shutdownNow();
            recipientExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
