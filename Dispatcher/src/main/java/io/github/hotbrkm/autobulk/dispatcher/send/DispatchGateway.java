package io.github.hotbrkm.autobulk.dispatcher.send;

import io.github.hotbrkm.autobulk.dispatcher.recipient.Recipient;

/**
 * Delivers one rendered message to one recipient.
 * <p>
 * Implementations report failures as a {@link DeliveryOutcome}; an unchecked exception is treated as a transient error.
 */
public interface DispatchGateway {

    DeliveryOutcome send(RenderedMessage message, Recipient recipient);
}
