package io.github.hotbrkm.autobulk.dispatcher.job;

import lombok.Builder;

import java.time.Instant;

/**
 * Immutable record of one poll-and-dispatch cycle of a job.
 */
@Builder
public record Execution(String id,
                        String jobId,
                        Instant attemptedAt,
                        Instant completedAt,
                        ExecutionOutcome outcome,
                        int recipientsAttempted,
                        int recipientsSucceeded,
                        int recipientsFailed,
                        String errorSummary,
                        int attemptNumber) {

    public static final int MAX_ERROR_SUMMARY_LENGTH = 1000;

    public Execution {
        errorSummary = truncate(errorSummary);
    }

    static String truncate(String summary) {
        if (summary == null || summary.length() <= MAX_ERROR_SUMMARY_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_ERROR_SUMMARY_LENGTH - 3) + "...";
    }
}
