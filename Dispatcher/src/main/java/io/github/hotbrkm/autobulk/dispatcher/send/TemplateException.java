package io.github.hotbrkm.autobulk.dispatcher.send;

/**
 * Template could not be rendered for a recipient. The recipient is counted as rejected.
 */
public class TemplateException extends RuntimeException {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
