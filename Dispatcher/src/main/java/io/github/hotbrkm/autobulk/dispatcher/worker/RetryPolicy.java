package io.github.hotbrkm.autobulk.dispatcher.worker;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff between failed cycles: {@code base * 2^(n-1)} seconds for the n-th consecutive failure.
 * <p>
 * Jitter is additive and applied before the cap, so successive delays never decrease.
 */
public final class RetryPolicy {

    // keeps now + backoff well inside the Instant range
    static final long MAX_BACKOFF_CEILING_SECONDS = Duration.ofDays(36_500).toSeconds();

    private final long maxBackoffSeconds;
    private final int jitterPercent;
    private final LongUnaryOperator jitterSource;

    public RetryPolicy(long maxBackoffSeconds, int jitterPercent) {
        this(maxBackoffSeconds, jitterPercent, bound -> ThreadLocalRandom.current().nextLong(bound + 1L));
    }

    /**
     * @param jitterSource returns a value in {@code [0, bound]} for the given bound
     */
    RetryPolicy(long maxBackoffSeconds, int jitterPercent, LongUnaryOperator jitterSource) {
        this.maxBackoffSeconds = maxBackoffSeconds > 0 ? Math.min(maxBackoffSeconds, MAX_BACKOFF_CEILING_SECONDS)
                : MAX_BACKOFF_CEILING_SECONDS;
        this.jitterPercent = Math.min(100, Math.max(0, jitterPercent));
        this.jitterSource = jitterSource;
    }

    public static RetryPolicy uncapped() {
        return new RetryPolicy(0L, 0);
    }

    /**
     * Delay before the attempt following the {@code retryCount}-th consecutive failure.
     */
    public Duration backoff(long baseSeconds, int retryCount) {
        long base = Math.max(1L, baseSeconds);
        long candidate = base;
        if (retryCount > 1) {
            double factor = Math.pow(2.0d, retryCount - 1);
            double raw = base * factor;
            candidate = raw >= MAX_BACKOFF_CEILING_SECONDS ? MAX_BACKOFF_CEILING_SECONDS : (long) raw;
        }
        if (jitterPercent > 0 && candidate < maxBackoffSeconds) {
            long bound = candidate * jitterPercent / 100L;
            if (bound > 0) {
                candidate += Math.min(bound, Math.max(0L, jitterSource.applyAsLong(bound)));
            }
        }
        return Duration.ofSeconds(Math.min(candidate, maxBackoffSeconds));
    }
}
