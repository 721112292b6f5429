package io.github.hotbrkm.autobulk.dispatcher.store;

/**
 * Persistence layer unavailable or rejected a statement.
 * <p>
 * The worker abandons the affected job for the current tick without consuming a retry.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
