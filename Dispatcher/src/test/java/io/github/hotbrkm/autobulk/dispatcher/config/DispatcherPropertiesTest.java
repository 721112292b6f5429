package io.github.hotbrkm.autobulk.dispatcher.config;

import io.github.hotbrkm.autobulk.dispatcher.worker.WorkerRuntimeOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispatcherProperties normalization test")
class DispatcherPropertiesTest {

    @Test
    @DisplayName("Non-positive values fall back to defaults")
    void resolve_fallsBackToDefaults() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.getWorker().setPollIntervalMs(0);
        properties.getWorker().setBatchLimit(-1);
        properties.getWorker().setRecipientParallelism(0);
        properties.getWorker().setFailureThresholdPercent(150);
        properties.getRetry().setDefaultMaxRetries(-2);
        properties.getRetry().setDefaultBackoffBaseSeconds(0);
        properties.getRetry().setJitterPercent(-10);
        properties.getSchedule().setDefaultTimeZone(" ");
        properties.getRecipients().setCachePath(null);

        assertThat(properties.getWorker().resolvePollIntervalMs()).isEqualTo(DispatcherProperties.Worker.DEFAULT_POLL_INTERVAL_MS);
        assertThat(properties.getWorker().resolveBatchLimit()).isEqualTo(DispatcherProperties.Worker.DEFAULT_BATCH_LIMIT);
        assertThat(properties.getWorker().resolveRecipientParallelism())
                .isEqualTo(DispatcherProperties.Worker.DEFAULT_RECIPIENT_PARALLELISM);
        assertThat(properties.getWorker().resolveFailureThresholdPercent()).isEqualTo(100);
        assertThat(properties.getRetry().resolveDefaultMaxRetries()).isEqualTo(DispatcherProperties.Retry.DEFAULT_MAX_RETRIES);
        assertThat(properties.getRetry().resolveDefaultBackoffBaseSeconds())
                .isEqualTo(DispatcherProperties.Retry.DEFAULT_BACKOFF_BASE_SECONDS);
        assertThat(properties.getRetry().resolveJitterPercent()).isZero();
        assertThat(properties.getSchedule().resolveDefaultTimeZone()).isEqualTo("UTC");
        assertThat(properties.getRecipients().resolveCachePath()).isEqualTo(DispatcherProperties.Recipients.DEFAULT_CACHE_PATH);
    }

    @Test
    @DisplayName("Runtime options carry the configured values and a default worker id")
    void runtimeOptions_fromProperties() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.getWorker().setBatchLimit(7);
        properties.getWorker().setLeaseTimeoutMs(120_000);
        properties.getRetry().setMaxBackoffSeconds(3_600);

        WorkerRuntimeOptions options = WorkerRuntimeOptions.fromProperties(properties);

        assertThat(options.batchLimit()).isEqualTo(7);
        assertThat(options.leaseTimeoutMs()).isEqualTo(120_000);
        assertThat(options.maxBackoffSeconds()).isEqualTo(3_600);
        assertThat(options.workerId()).isNotBlank().contains(":");
        assertThat(WorkerRuntimeOptions.defaults("node-a").workerId()).isEqualTo("node-a");
    }

    @Test
    @DisplayName("Lease shorter than the recipient timeout is raised to outlast it")
    void runtimeOptions_leaseOutlastsRecipientTimeout() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.getWorker().setLeaseTimeoutMs(10_000);
        properties.getWorker().setRecipientTimeoutMs(60_000);

        WorkerRuntimeOptions options = WorkerRuntimeOptions.fromProperties(properties);

        assertThat(options.recipientTimeoutMs()).isEqualTo(60_000);
        assertThat(options.leaseTimeoutMs()).isEqualTo(60_000 + WorkerRuntimeOptions.LEASE_MARGIN_MS);
    }
}
