package org.example.storybook.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.ImageHandle;
import org.example.storybook.service.ProviderRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Image provider backed by the OpenAI Responses API with the image_generation tool.
 * A session is an OpenAI conversation; every turn sent with its id sees the earlier turns,
 * which keeps characters and style stable between illustrations.
 */
public class OpenAiImageProvider implements ImageProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiImageProvider.class);

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String size;
    private final String quality;
    private final int timeoutSeconds;
    private final ProviderRetryPolicy retryPolicy;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiImageProvider(
            String baseUrl,
            String apiKey,
            String model,
            String size,
            String quality,
            int timeoutSeconds,
            ProviderRetryPolicy retryPolicy) {
        this.apiKey = apiKey;
        this.model = model;
        this.size = size;
        this.quality = quality;
        this.timeoutSeconds = timeoutSeconds;
        this.retryPolicy = retryPolicy;
        // Generated images come back inline as base64, so allow large bodies (32MB)
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(32 * 1024 * 1024))
                .build();
        log.info("OpenAI image provider initialized: baseUrl={}, model={}, size={}, quality={}",
                baseUrl, model, size, quality);
    }

    @Override
    public String openSession(String storyId) {
        Map<String, Object> requestBody = Map.of("metadata", Map.of("story_id", storyId));
        JsonNode response = retryPolicy.execute("OpenAI open conversation",
                () -> post("/conversations", requestBody));
        JsonNode id = response.get("id");
        if (id == null || id.asText().isBlank()) {
            throw new ImageProviderException("OpenAI conversation response did not contain an id");
        }
        log.info("Opened OpenAI conversation {} for story {}", id.asText(), storyId);
        return id.asText();
    }

    @Override
    public void primeSession(String sessionId, String primingPrompt) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("conversation", sessionId);
        requestBody.put("input", primingPrompt);
        JsonNode response = retryPolicy.execute("OpenAI priming turn",
                () -> post("/responses", requestBody));
        log.debug("Priming turn accepted for conversation {}: response {}", sessionId, response.path("id").asText());
    }

    @Override
    public ImageHandle generateInSession(String sessionId, String prompt) {
        Map<String, Object> requestBody = imageRequest(prompt);
        requestBody.put("conversation", sessionId);
        return retryPolicy.execute("OpenAI image turn", () -> toImageHandle(post("/responses", requestBody)));
    }

    @Override
    public ImageHandle generate(String prompt) {
        Map<String, Object> requestBody = imageRequest(prompt);
        return retryPolicy.execute("OpenAI image generation", () -> toImageHandle(post("/responses", requestBody)));
    }

    private Map<String, Object> imageRequest(String prompt) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", prompt);
        requestBody.put("tools", List.of(Map.of(
                "type", "image_generation",
                "size", size,
                "quality", quality
        )));
        return requestBody;
    }

    private JsonNode post(String uri, Map<String, Object> requestBody) {
        try {
            String response = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            JsonNode node = objectMapper.readTree(response);
            if (node == null || node.isMissingNode()) {
                throw new ImageProviderException("Empty response from OpenAI " + uri);
            }
            return node;
        } catch (WebClientResponseException e) {
            log.error("OpenAI API error on {}: {} - {}", uri, e.getStatusCode(), e.getResponseBodyAsString());
            throw new ImageProviderException("OpenAI API error: " + e.getStatusCode(), e);
        } catch (ImageProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI request to {} failed", uri, e);
            throw new ImageProviderException("OpenAI request to " + uri + " failed: " + e.getMessage(), e);
        }
    }

    ImageHandle toImageHandle(JsonNode response) {
        String responseId = response.path("id").asText(null);
        JsonNode output = response.get("output");
        if (output != null && output.isArray()) {
            for (JsonNode item : output) {
                if ("image_generation_call".equals(item.path("type").asText())) {
                    String result = item.path("result").asText("");
                    if (!result.isBlank()) {
                        return new ImageHandle(toImageUrl(result), responseId);
                    }
                    log.warn("image_generation_call item without result in response {}", responseId);
                }
                JsonNode content = item.get("content");
                if (content != null && content.isArray()) {
                    for (JsonNode contentItem : content) {
                        if ("image".equals(contentItem.path("type").asText())) {
                            String url = contentItem.path("image_url").path("url").asText(
                                    contentItem.path("url").asText(""));
                            if (!url.isBlank()) {
                                return new ImageHandle(url, responseId);
                            }
                        }
                    }
                }
            }
        }
        throw new ImageProviderException("No image was generated in the response");
    }

    private String toImageUrl(String result) {
        if (result.startsWith("http") || result.startsWith("data:")) {
            return result;
        }
        return "data:image/png;base64," + result;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
