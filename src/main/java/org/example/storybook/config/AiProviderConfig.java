package org.example.storybook.config;

import org.example.storybook.service.ProviderRetryPolicy;
import org.example.storybook.service.image.ImageProvider;
import org.example.storybook.service.image.OpenAiImageProvider;
import org.example.storybook.service.image.StubImageProvider;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.OllamaLlmProvider;
import org.example.storybook.service.llm.OpenAiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the text and image generation providers.
 */
@Configuration
public class AiProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(AiProviderConfig.class);

    // Text provider config
    @Value("${ai.text.provider:ollama}")
    private String textProvider;

    @Value("${ai.text.timeout-seconds:180}")
    private int textTimeoutSeconds;

    @Value("${ai.text.ollama.base-url:http://localhost:11434}")
    private String textOllamaBaseUrl;

    @Value("${ai.text.ollama.model:llama3.1:latest}")
    private String textOllamaModel;

    @Value("${ai.text.openai.base-url:https://api.openai.com/v1}")
    private String textOpenAiBaseUrl;

    @Value("${ai.text.openai.api-key:}")
    private String textOpenAiApiKey;

    @Value("${ai.text.openai.model:gpt-4o-mini}")
    private String textOpenAiModel;

    // Image provider config
    @Value("${ai.image.provider:stub}")
    private String imageProvider;

    @Value("${ai.image.timeout-seconds:300}")
    private int imageTimeoutSeconds;

    @Value("${ai.image.openai.base-url:https://api.openai.com/v1}")
    private String imageOpenAiBaseUrl;

    @Value("${ai.image.openai.api-key:}")
    private String imageOpenAiApiKey;

    @Value("${ai.image.openai.model:gpt-4o}")
    private String imageOpenAiModel;

    @Value("${ai.image.size:1024x1024}")
    private String imageSize;

    @Value("${ai.image.quality:high}")
    private String imageQuality;

    // Retry policy
    @Value("${generation.retry.max-attempts:1}")
    private int retryMaxAttempts;

    @Value("${generation.retry.initial-delay-ms:2000}")
    private long retryInitialDelayMs;

    @Value("${generation.retry.max-delay-ms:60000}")
    private long retryMaxDelayMs;

    @Bean
    public ProviderRetryPolicy providerRetryPolicy() {
        log.info("Provider retry policy: maxAttempts={}, initialDelayMs={}, maxDelayMs={}",
                retryMaxAttempts, retryInitialDelayMs, retryMaxDelayMs);
        return new ProviderRetryPolicy(retryMaxAttempts, retryInitialDelayMs, retryMaxDelayMs);
    }

    @Bean
    @Qualifier("textLlmProvider")
    public LlmProvider textLlmProvider(ProviderRetryPolicy retryPolicy) {
        log.info("Configuring text LLM provider: {}", textProvider);
        return switch (textProvider.toLowerCase()) {
            case "ollama" -> ollama(retryPolicy);
            case "openai" -> {
                if (textOpenAiApiKey == null || textOpenAiApiKey.isBlank()) {
                    log.warn("OpenAI API key not configured for text provider, falling back to Ollama");
                    yield ollama(retryPolicy);
                }
                log.info("Creating OpenAI text provider: model={}", textOpenAiModel);
                yield new OpenAiLlmProvider(textOpenAiBaseUrl, textOpenAiApiKey, textOpenAiModel,
                        textTimeoutSeconds, retryPolicy);
            }
            default -> {
                log.warn("Unknown text provider type '{}', falling back to Ollama", textProvider);
                yield ollama(retryPolicy);
            }
        };
    }

    @Bean
    public ImageProvider imageProvider(ProviderRetryPolicy retryPolicy) {
        log.info("Configuring image provider: {}", imageProvider);
        return switch (imageProvider.toLowerCase()) {
            case "stub" -> new StubImageProvider();
            case "openai" -> {
                if (imageOpenAiApiKey == null || imageOpenAiApiKey.isBlank()) {
                    log.warn("OpenAI API key not configured for image provider, falling back to stub images");
                    yield new StubImageProvider();
                }
                log.info("Creating OpenAI image provider: model={}, size={}, quality={}",
                        imageOpenAiModel, imageSize, imageQuality);
                yield new OpenAiImageProvider(imageOpenAiBaseUrl, imageOpenAiApiKey, imageOpenAiModel,
                        imageSize, imageQuality, imageTimeoutSeconds, retryPolicy);
            }
            default -> {
                log.warn("Unknown image provider type '{}', falling back to stub images", imageProvider);
                yield new StubImageProvider();
            }
        };
    }

    private LlmProvider ollama(ProviderRetryPolicy retryPolicy) {
        log.info("Creating Ollama text provider: baseUrl={}, model={}", textOllamaBaseUrl, textOllamaModel);
        return new OllamaLlmProvider(textOllamaBaseUrl, textOllamaModel, textTimeoutSeconds, retryPolicy);
    }
}
