package io.github.hotbrkm.autobulk.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "autobulk")
public class DispatcherProperties {

    private Worker worker = new Worker();
    private Retry retry = new Retry();
    private Schedule schedule = new Schedule();
    private Recipients recipients = new Recipients();

    @Data
    public static class Worker {
        public static final long DEFAULT_POLL_INTERVAL_MS = 5_000L;
        public static final int DEFAULT_BATCH_LIMIT = 50;
        public static final long DEFAULT_LEASE_TIMEOUT_MS = 300_000L;
        public static final int DEFAULT_RECIPIENT_PARALLELISM = 4;
        public static final long DEFAULT_RECIPIENT_TIMEOUT_MS = 60_000L;

        private boolean enabled = true;
        private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
        private int batchLimit = DEFAULT_BATCH_LIMIT;
        private long leaseTimeoutMs = DEFAULT_LEASE_TIMEOUT_MS;
        private int recipientParallelism = DEFAULT_RECIPIENT_PARALLELISM;
        private long recipientTimeoutMs = DEFAULT_RECIPIENT_TIMEOUT_MS;

        // 0 means any failed recipient fails the cycle
        private int failureThresholdPercent;

        // defaults to host:pid when empty
        private String workerId;

        public long resolvePollIntervalMs() {
            return pollIntervalMs > 0 ? pollIntervalMs : DEFAULT_POLL_INTERVAL_MS;
        }

        public int resolveBatchLimit() {
            return batchLimit > 0 ? batchLimit : DEFAULT_BATCH_LIMIT;
        }

        public long resolveLeaseTimeoutMs() {
            return leaseTimeoutMs > 0 ? leaseTimeoutMs : DEFAULT_LEASE_TIMEOUT_MS;
        }

        public int resolveRecipientParallelism() {
            return recipientParallelism > 0 ? recipientParallelism : DEFAULT_RECIPIENT_PARALLELISM;
        }

        public long resolveRecipientTimeoutMs() {
            return recipientTimeoutMs > 0 ? recipientTimeoutMs : DEFAULT_RECIPIENT_TIMEOUT_MS;
        }

        public int resolveFailureThresholdPercent() {
            return Math.min(100, Math.max(0, failureThresholdPercent));
        }
    }

    @Data
    public static class Retry {
        public static final int DEFAULT_MAX_RETRIES = 3;
        public static final long DEFAULT_BACKOFF_BASE_SECONDS = 30L;

        private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
        private long defaultBackoffBaseSeconds = DEFAULT_BACKOFF_BASE_SECONDS;

        // 0 means uncapped
        private long maxBackoffSeconds;
        private int jitterPercent;

        public int resolveDefaultMaxRetries() {
            return defaultMaxRetries >= 0 ? defaultMaxRetries : DEFAULT_MAX_RETRIES;
        }

        public long resolveDefaultBackoffBaseSeconds() {
            return defaultBackoffBaseSeconds > 0 ? defaultBackoffBaseSeconds : DEFAULT_BACKOFF_BASE_SECONDS;
        }

        public long resolveMaxBackoffSeconds() {
            return Math.max(0L, maxBackoffSeconds);
        }

        public int resolveJitterPercent() {
            return Math.min(100, Math.max(0, jitterPercent));
        }
    }

    @Data
    public static class Schedule {
        public static final String DEFAULT_TIME_ZONE = "UTC";

        private String defaultTimeZone = DEFAULT_TIME_ZONE;

        public String resolveDefaultTimeZone() {
            return defaultTimeZone == null || defaultTimeZone.isBlank() ? DEFAULT_TIME_ZONE : defaultTimeZone.trim();
        }
    }

    @Data
    public static class Recipients {
        public static final String DEFAULT_CACHE_PATH = "data/recipients.csv";

        private String cachePath = DEFAULT_CACHE_PATH;

        public String resolveCachePath() {
            return cachePath == null || cachePath.isBlank() ? DEFAULT_CACHE_PATH : cachePath.trim();
        }
    }
}
