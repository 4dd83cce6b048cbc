package org.example.storybook.service.session;

import org.example.storybook.model.ArtBible;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one story's image conversation.
 * Every change produces a new instance that replaces the old one in the {@link VisualSessionStore}.
 */
public record VisualSession(
    String storyId,
    String sessionId,
    boolean contextInitialized,
    ArtBible artBibleSnapshot,
    Map<String, String> characterReferenceSnapshots,
    LocalDateTime initializedAt
) {
    public VisualSession {
        characterReferenceSnapshots = characterReferenceSnapshots == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(characterReferenceSnapshots));
    }

    public static VisualSession active(
            String storyId,
            String sessionId,
            ArtBible artBible,
            Map<String, String> characterReferences) {
        return new VisualSession(storyId, sessionId, true, artBible, characterReferences, LocalDateTime.now());
    }

    /**
     * A handle whose priming cannot be confirmed, e.g. one recovered after a restart.
     */
    public static VisualSession partial(String storyId, String sessionId) {
        return new VisualSession(storyId, sessionId, false, null, Map.of(), null);
    }

    public SessionState state() {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionState.NONE;
        }
        return contextInitialized ? SessionState.ACTIVE : SessionState.PARTIAL;
    }

    public VisualSession withArtBible(ArtBible artBible) {
        return new VisualSession(storyId, sessionId, contextInitialized, artBible,
                characterReferenceSnapshots, initializedAt);
    }

    public VisualSession withCharacterReference(String characterName, String referencePrompt) {
        Map<String, String> references = new LinkedHashMap<>(characterReferenceSnapshots);
        references.put(characterName, referencePrompt);
        return new VisualSession(storyId, sessionId, contextInitialized, artBibleSnapshot,
                references, initializedAt);
    }
}
