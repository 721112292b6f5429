package io.github.hotbrkm.autobulk.dispatcher.send;

import java.util.Map;

/**
 * Message produced by the {@link TemplateRenderer} for a single recipient.
 */
public record RenderedMessage(String templateRef, Map<String, String> variables) {

    public RenderedMessage {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
