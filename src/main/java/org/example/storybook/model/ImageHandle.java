package org.example.storybook.model;

/**
 * Result of one image provider call: where the image can be fetched from and the provider's id
 * for the response that produced it.
 */
public record ImageHandle(
    String imageUrl,
    String responseId
) {
}
