package org.example.storybook.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.service.ProviderRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for OpenAI and OpenAI-compatible endpoints.
 * Calls the /chat/completions endpoint.
 */
public class OpenAiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ProviderRetryPolicy retryPolicy;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds,
                             ProviderRetryPolicy retryPolicy) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.retryPolicy = retryPolicy;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("OpenAI LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (options.systemMessage() != null && !options.systemMessage().isBlank()) {
            messages.add(Map.of("role", "system", "content", options.systemMessage()));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("messages", messages);
        requestBody.put("temperature", options.temperature());
        if (options.topP() != null) {
            requestBody.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            requestBody.put("max_tokens", options.maxTokens());
        }

        return retryPolicy.execute("OpenAI chat completion", () -> post(requestBody));
    }

    private String post(Map<String, Object> requestBody) {
        try {
            String response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode choices = responseNode == null ? null : responseNode.get("choices");
            if (choices != null && choices.isArray() && choices.size() > 0) {
                JsonNode message = choices.get(0).get("message");
                if (message != null && message.has("content")) {
                    return message.get("content").asText();
                }
            }

            throw new LlmProviderException("Invalid response format from OpenAI API");

        } catch (WebClientResponseException e) {
            log.error("OpenAI API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("OpenAI API error: " + e.getStatusCode(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from OpenAI", e);
            throw new LlmProviderException("Failed to generate response from OpenAI: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("OpenAI not available: API key not configured");
            return false;
        }
        // Assume availability when a key is set; a models call would cost a round trip
        return true;
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
