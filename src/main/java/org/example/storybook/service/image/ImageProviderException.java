package org.example.storybook.service.image;

import org.example.storybook.service.ProviderException;

/**
 * Exception thrown when an image generation provider encounters an error.
 */
public class ImageProviderException extends ProviderException {

    public ImageProviderException(String message) {
        super(message);
    }

    public ImageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
