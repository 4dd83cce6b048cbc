package org.example.storybook.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,          // nullable
    Integer maxTokens,    // nullable
    String systemMessage  // nullable
) {
    /**
     * Create options with just temperature.
     */
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null, null);
    }

    /**
     * Create options with temperature and a completion token cap.
     */
    public static LlmOptions withTemperatureAndMaxTokens(double temp, int maxTokens) {
        return new LlmOptions(temp, null, maxTokens, null);
    }

    public LlmOptions withSystemMessage(String message) {
        return new LlmOptions(temperature, topP, maxTokens, message);
    }
}
