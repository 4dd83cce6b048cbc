package org.example.storybook.service;

/**
 * Base for failures reported by an external generation provider: connection errors, timeouts and
 * responses that cannot be interpreted. Callers treat every subclass as one kind of failure.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
