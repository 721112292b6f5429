package io.github.hotbrkm.autobulk.dispatcher.recipient;

/**
 * Recipient source unavailable or empty. Counts as a retryable job-level failure.
 */
public class ResolutionException extends RuntimeException {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
