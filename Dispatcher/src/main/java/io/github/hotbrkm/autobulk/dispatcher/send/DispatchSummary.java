package io.github.hotbrkm.autobulk.dispatcher.send;

import java.util.List;

/**
 * Aggregated per-recipient results of one dispatch cycle.
 *
 * @param errors one line per failed recipient, in recipient order
 */
public record DispatchSummary(int attempted, int succeeded, int failed, List<String> errors) {

    public DispatchSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0, List.of());
    }

    public String errorSummary() {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }
}
