package org.example.storybook.service.llm;

import org.example.storybook.service.ProviderException;

/**
 * Exception thrown when a text generation provider encounters an error.
 */
public class LlmProviderException extends ProviderException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
