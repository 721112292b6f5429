package io.github.hotbrkm.autobulk.dispatcher.send;

import java.util.Map;

public interface TemplateRenderer {

    /**
     * @throws TemplateException if the template cannot be rendered with the given variables
     */
    RenderedMessage render(String templateRef, Map<String, String> variables);
}
