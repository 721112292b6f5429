package io.github.hotbrkm.autobulk.dispatcher.send;

/**
 * Per-recipient result reported by a {@link DispatchGateway}.
 */
public record DeliveryOutcome(Status status, String reason) {

    public enum Status {
        DELIVERED,
        REJECTED,
        TRANSIENT_ERROR
    }

    public static DeliveryOutcome delivered() {
        return new DeliveryOutcome(Status.DELIVERED, null);
    }

    public static DeliveryOutcome rejected(String reason) {
        return new DeliveryOutcome(Status.REJECTED, reason);
    }

    public static DeliveryOutcome transientError(String reason) {
        return new DeliveryOutcome(Status.TRANSIENT_ERROR, reason);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
