package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.ImageHandle;
import org.example.storybook.model.SessionStatus;
import org.example.storybook.service.image.ImageProvider;
import org.example.storybook.service.session.SessionNotReadyException;
import org.example.storybook.service.session.SessionState;
import org.example.storybook.service.session.VisualSession;
import org.example.storybook.service.session.VisualSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns one image conversation per story so illustrations for the same book share context.
 * <p>
 * Initialization (open + priming turn) runs under a per-story lock and only publishes the new
 * session once priming has succeeded, so a failed attempt leaves whatever was there before.
 * Generation turns read the published snapshot without locking.
 */
@Service
public class VisualConsistencySessionManager {

    private static final Logger log = LoggerFactory.getLogger(VisualConsistencySessionManager.class);

    private final ImageProvider imageProvider;
    private final ConsistencyPromptAssembler promptAssembler;
    private final VisualSessionStore sessionStore;

    public VisualConsistencySessionManager(
            ImageProvider imageProvider,
            ConsistencyPromptAssembler promptAssembler,
            VisualSessionStore sessionStore) {
        this.imageProvider = imageProvider;
        this.promptAssembler = promptAssembler;
        this.sessionStore = sessionStore;
    }

    public SessionStatus status(String storyId) {
        if (storyId == null || storyId.isBlank()) {
            return SessionStatus.none(storyId);
        }
        return sessionStore.get(storyId)
                .map(session -> new SessionStatus(
                        storyId,
                        session.state() != SessionState.NONE,
                        session.state() == SessionState.ACTIVE,
                        session.state()))
                .orElseGet(() -> SessionStatus.none(storyId));
    }

    public Optional<VisualSession> getSession(String storyId) {
        return sessionStore.get(storyId);
    }

    public String ensureSession(String storyId, ArtBible artBible, List<CharacterProfile> characterProfiles) {
        return ensureSession(storyId, artBible, characterProfiles, Map.of());
    }

    /**
     * Return the story's session id, opening and priming a new conversation if none is active.
     *
     * @param referencePrompts stored reference prompts per character name, used instead of
     *                         prompts generated from the profiles
     */
    public String ensureSession(
            String storyId,
            ArtBible artBible,
            List<CharacterProfile> characterProfiles,
            Map<String, String> referencePrompts) {
        requireStoryId(storyId);
        VisualSession current = sessionStore.get(storyId).orElse(null);
        if (current != null && current.state() == SessionState.ACTIVE) {
            return current.sessionId();
        }

        ReentrantLock lock = sessionStore.acquire(storyId);
        try {
            current = sessionStore.get(storyId).orElse(null);
            if (current != null && current.state() == SessionState.ACTIVE) {
                return current.sessionId();
            }
            if (current != null && current.state() == SessionState.PARTIAL) {
                log.info("Replacing partial visual session {} for story {}", current.sessionId(), storyId);
            }
            return initialize(storyId, artBible, characterProfiles, referencePrompts);
        } finally {
            lock.unlock();
        }
    }

    public String rebuild(String storyId, ArtBible artBible, List<CharacterProfile> characterProfiles) {
        return rebuild(storyId, artBible, characterProfiles, Map.of());
    }

    /**
     * Discard any existing session and prime a fresh one from the given inputs.
     * If the new conversation cannot be primed the previous session is left as it was.
     */
    public String rebuild(
            String storyId,
            ArtBible artBible,
            List<CharacterProfile> characterProfiles,
            Map<String, String> referencePrompts) {
        requireStoryId(storyId);
        ReentrantLock lock = sessionStore.acquire(storyId);
        try {
            sessionStore.get(storyId).ifPresent(previous ->
                    log.info("Rebuilding visual session for story {} (was {} in state {})",
                            storyId, previous.sessionId(), previous.state()));
            return initialize(storyId, artBible, characterProfiles, referencePrompts);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Send one generation turn into the story's primed conversation.
     *
     * @throws SessionNotReadyException if the story has no active session; no provider call is made
     */
    public ImageHandle continueGeneration(String storyId, String prompt) {
        VisualSession session = sessionStore.get(storyId).orElse(null);
        SessionState state = session == null ? SessionState.NONE : session.state();
        if (state != SessionState.ACTIVE) {
            throw new SessionNotReadyException(storyId, state);
        }
        log.debug("Generating image in session {} for story {}", session.sessionId(), storyId);
        return imageProvider.generateInSession(session.sessionId(), prompt);
    }

    public void recordArtBible(String storyId, ArtBible artBible) {
        updateSession(storyId, session -> session.withArtBible(artBible));
    }

    public void recordCharacterReference(String storyId, String characterName, String referencePrompt) {
        updateSession(storyId, session -> session.withCharacterReference(characterName, referencePrompt));
    }

    /**
     * Record a handle obtained elsewhere, e.g. one a client kept across a restart. Its priming
     * cannot be confirmed, so it is stored as {@link SessionState#PARTIAL} and must be rebuilt.
     * An active session is left untouched.
     */
    public SessionStatus adoptHandle(String storyId, String sessionId) {
        requireStoryId(storyId);
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        ReentrantLock lock = sessionStore.acquire(storyId);
        try {
            VisualSession current = sessionStore.get(storyId).orElse(null);
            if (current != null && current.state() == SessionState.ACTIVE) {
                log.debug("Story {} already has active session {}; ignoring adopted handle", storyId, current.sessionId());
            } else {
                sessionStore.put(VisualSession.partial(storyId, sessionId));
            }
        } finally {
            lock.unlock();
        }
        return status(storyId);
    }

    public boolean clear(String storyId) {
        if (storyId == null || storyId.isBlank()) {
            return false;
        }
        ReentrantLock lock = sessionStore.acquire(storyId);
        try {
            boolean removed = sessionStore.removeLocked(storyId, lock).isPresent();
            if (removed) {
                log.info("Cleared visual session for story {}", storyId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private String initialize(
            String storyId,
            ArtBible artBible,
            List<CharacterProfile> characterProfiles,
            Map<String, String> referencePrompts) {
        if (artBible == null) {
            throw new IllegalArgumentException("An art bible is required to prime a visual session");
        }
        List<CharacterProfile> profiles = characterProfiles == null ? List.of() : characterProfiles;
        Map<String, String> references = promptAssembler.characterReferencePrompts(
                profiles, artBible.artStyle(), referencePrompts);
        String primingPrompt = promptAssembler.buildPrimingPrompt(artBible, profiles, references);

        String sessionId = imageProvider.openSession(storyId);
        imageProvider.primeSession(sessionId, primingPrompt);

        sessionStore.put(VisualSession.active(storyId, sessionId, artBible, references));
        log.info("Primed visual session {} for story {} with {} character reference(s)",
                sessionId, storyId, references.size());
        return sessionId;
    }

    private void updateSession(String storyId, UnaryOperator<VisualSession> change) {
        if (storyId == null || storyId.isBlank()) {
            return;
        }
        ReentrantLock lock = sessionStore.acquire(storyId);
        try {
            Optional<VisualSession> current = sessionStore.get(storyId);
            if (current.isEmpty()) {
                log.debug("No visual session for story {}; snapshot update skipped", storyId);
                return;
            }
            sessionStore.put(change.apply(current.get()));
        } finally {
            lock.unlock();
        }
    }

    private void requireStoryId(String storyId) {
        if (storyId == null || storyId.isBlank()) {
            throw new IllegalArgumentException("storyId is required");
        }
    }
}
