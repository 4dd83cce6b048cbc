package org.example.storybook.service.llm;

/**
 * Abstraction for text generation providers (Ollama, OpenAI-compatible APIs).
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param prompt the prompt to send
     * @param options generation options (temperature, system message, etc.)
     * @return the generated text response
     * @throws LlmProviderException on connection, timeout or malformed-response failures
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging (e.g., "ollama", "openai").
     */
    String getProviderName();
}
