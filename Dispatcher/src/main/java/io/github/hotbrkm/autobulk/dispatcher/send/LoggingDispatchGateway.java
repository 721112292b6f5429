package io.github.hotbrkm.autobulk.dispatcher.send;

import io.github.hotbrkm.autobulk.dispatcher.recipient.EmailAddressUtil;
import io.github.hotbrkm.autobulk.dispatcher.recipient.Recipient;
import lombok.extern.slf4j.Slf4j;

/**
 * Gateway that logs each message instead of sending it.
 */
@Slf4j
public class LoggingDispatchGateway implements DispatchGateway {

    @Override
    public DeliveryOutcome send(RenderedMessage message, Recipient recipient) {
        String domain = recipient.getDomain();
        if (EmailAddressUtil.INVALID.equals(domain)) {
            log.warn("Rejecting recipient with invalid address: {}", recipient.email());
            return DeliveryOutcome.rejected("Invalid recipient address: " + recipient.email());
        }
        log.info("Dispatch template '{}' to {} (domain: {}, variables: {})",
                message.templateRef(), recipient.email(), domain, message.variables().keySet());
        return DeliveryOutcome.delivered();
    }
}
