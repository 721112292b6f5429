package io.github.hotbrkm.autobulk.dispatcher.worker;

import io.github.hotbrkm.autobulk.dispatcher.send.DispatchSummary;

/**
 * Decides whether a dispatch cycle counts as failed from its recipient counts.
 * <p>
 * A cycle fails when at least one recipient failed and the failed share reaches {@code thresholdPercent}.
 * With the default of 0 any failed recipient fails the cycle.
 */
public record FailureThresholdPolicy(int thresholdPercent) {

    public FailureThresholdPolicy {
        thresholdPercent = Math.min(100, Math.max(0, thresholdPercent));
    }

    public static FailureThresholdPolicy anyFailure() {
        return new FailureThresholdPolicy(0);
    }

    public boolean isFailure(DispatchSummary summary) {
        int failed = summary.failed();
        return failed > 0 && (long) failed * 100L >= (long) thresholdPercent * summary.attempted();
    }
}
