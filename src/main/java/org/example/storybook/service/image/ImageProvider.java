package org.example.storybook.service.image;

import org.example.storybook.model.ImageHandle;

/**
 * Abstraction for image generation providers that can hold a multi-turn conversation.
 * Conversation handles are provider-side and do not outlive the process that opened them.
 */
public interface ImageProvider {

    /**
     * Open a new provider-side conversation.
     *
     * @param storyId story the conversation belongs to, for provider-side bookkeeping
     * @return opaque session id used by the other calls
     */
    String openSession(String storyId);

    /**
     * Send the priming turn (style and character context) into an open conversation.
     * No image is requested by this turn.
     */
    void primeSession(String sessionId, String primingPrompt);

    /**
     * Generate an image as the next turn of an open conversation.
     */
    ImageHandle generateInSession(String sessionId, String prompt);

    /**
     * Generate an image without any conversation context.
     */
    ImageHandle generate(String prompt);

    boolean isAvailable();

    String getProviderName();
}
