package org.example.storybook.service.image;

import org.example.storybook.model.ImageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Image provider for local development: returns placeholder image URLs instead of calling a real
 * image service. Sessions are plain generated ids.
 */
public class StubImageProvider implements ImageProvider {

    private static final Logger log = LoggerFactory.getLogger(StubImageProvider.class);
    private static final String PLACEHOLDER_BASE_URL = "https://via.placeholder.com/1024x1024?text=";

    private final AtomicInteger callCount = new AtomicInteger();

    @Override
    public String openSession(String storyId) {
        String sessionId = "stub-session-" + UUID.randomUUID();
        log.debug("Opened stub session {} for story {}", sessionId, storyId);
        return sessionId;
    }

    @Override
    public void primeSession(String sessionId, String primingPrompt) {
        log.debug("Primed stub session {} ({} chars)", sessionId, primingPrompt.length());
    }

    @Override
    public ImageHandle generateInSession(String sessionId, String prompt) {
        return placeholder(prompt);
    }

    @Override
    public ImageHandle generate(String prompt) {
        return placeholder(prompt);
    }

    public int getCallCount() {
        return callCount.get();
    }

    private ImageHandle placeholder(String prompt) {
        int call = callCount.incrementAndGet();
        String label = Arrays.stream(prompt.trim().split("\\s+"))
                .limit(3)
                .collect(Collectors.joining(" "));
        if (label.isBlank()) {
            label = "Story Image";
        }
        String url = PLACEHOLDER_BASE_URL + URLEncoder.encode(label, StandardCharsets.UTF_8);
        return new ImageHandle(url, "stub-response-" + call);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getProviderName() {
        return "stub";
    }
}
