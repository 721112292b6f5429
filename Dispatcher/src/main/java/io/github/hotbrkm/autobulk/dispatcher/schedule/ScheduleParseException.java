package io.github.hotbrkm.autobulk.dispatcher.schedule;

/**
 * Rejected schedule definition (bad cron expression, missing timestamp, unknown zone).
 * <p>
 * Only thrown on the job creation path; the worker never sees it.
 */
public class ScheduleParseException extends RuntimeException {
    public ScheduleParseException(String message) {
        super(message);
    }

    public ScheduleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
