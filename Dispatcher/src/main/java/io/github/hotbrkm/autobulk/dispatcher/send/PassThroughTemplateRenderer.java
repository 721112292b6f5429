package io.github.hotbrkm.autobulk.dispatcher.send;

import java.util.Map;

/**
 * Hands the template reference and variables through unchanged. Real rendering belongs to the provider.
 */
public class PassThroughTemplateRenderer implements TemplateRenderer {

    @Override
    public RenderedMessage render(String templateRef, Map<String, String> variables) {
        if (templateRef == null || templateRef.isBlank()) {
            throw new TemplateException("Template reference is empty");
        }
        return new RenderedMessage(templateRef, variables);
    }
}
