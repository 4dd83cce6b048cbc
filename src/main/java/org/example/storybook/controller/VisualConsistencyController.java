package org.example.storybook.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.model.SessionStatus;
import org.example.storybook.service.ConsistencyPromptAssembler;
import org.example.storybook.service.ProviderException;
import org.example.storybook.service.SessionInputService;
import org.example.storybook.service.VisualConsistencySessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Visual session status and repair, plus previews of the prompts the illustration tasks send.
 */
@RestController
@RequestMapping("/api/visual-consistency")
public class VisualConsistencyController {

    private static final Logger log = LoggerFactory.getLogger(VisualConsistencyController.class);

    private final VisualConsistencySessionManager sessionManager;
    private final SessionInputService sessionInputService;
    private final ConsistencyPromptAssembler promptAssembler;

    public VisualConsistencyController(
            VisualConsistencySessionManager sessionManager,
            SessionInputService sessionInputService,
            ConsistencyPromptAssembler promptAssembler) {
        this.sessionManager = sessionManager;
        this.sessionInputService = sessionInputService;
        this.promptAssembler = promptAssembler;
    }

    @GetMapping("/sessions/{storyId}")
    public SessionStatus getSessionStatus(@PathVariable String storyId) {
        return sessionManager.status(storyId);
    }

    /**
     * Discard the story's session and prime a new one from the stored project.
     */
    @PostMapping("/sessions/{storyId}/rebuild")
    public ResponseEntity<?> rebuildSession(@PathVariable String storyId, HttpServletRequest request) {
        Optional<SessionInputs> inputs = sessionInputService.resolveStored(storyId);
        if (inputs.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ApiError("No stored project for story " + storyId, RequestCorrelation.resolveRequestId(request)));
        }
        try {
            String sessionId = sessionManager.rebuild(
                    storyId, inputs.get().artBible(), inputs.get().characters(), inputs.get().referencePrompts());
            return ResponseEntity.ok(new RebuildResponse(storyId, sessionId));
        } catch (ProviderException e) {
            log.warn("Session rebuild failed for story {}: {}", storyId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ApiError(e.getMessage(), RequestCorrelation.resolveRequestId(request)));
        }
    }

    /**
     * Record a session handle the client kept, e.g. across a restart. It is reported as partial
     * until rebuilt.
     */
    @PostMapping("/sessions/{storyId}/adopt")
    public ResponseEntity<?> adoptSession(
            @PathVariable String storyId,
            @RequestBody AdoptSessionRequest body,
            HttpServletRequest request) {
        if (body == null || body.sessionId() == null || body.sessionId().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ApiError("sessionId is required", RequestCorrelation.resolveRequestId(request)));
        }
        return ResponseEntity.ok(sessionManager.adoptHandle(storyId, body.sessionId()));
    }

    @DeleteMapping("/sessions/{storyId}")
    public ClearSessionResponse clearSession(@PathVariable String storyId) {
        return new ClearSessionResponse(storyId, sessionManager.clear(storyId));
    }

    @PostMapping("/art-bible/prompt")
    public ResponseEntity<?> artBiblePrompt(@RequestBody ArtBiblePromptRequest body, HttpServletRequest request) {
        try {
            return ResponseEntity.ok(promptAssembler.buildArtBible(
                    body.artStyle(), body.genre(), body.title(), body.additionalNotes()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(new ApiError(e.getMessage(), RequestCorrelation.resolveRequestId(request)));
        }
    }

    @PostMapping("/character-reference/prompt")
    public ResponseEntity<?> characterReferencePrompt(
            @RequestBody CharacterReferencePromptRequest body,
            HttpServletRequest request) {
        try {
            CharacterReference reference = promptAssembler.buildCharacterReference(
                    body.character(), body.artStyle(), !Boolean.FALSE.equals(body.includeTurnaround()));
            return ResponseEntity.ok(reference);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(new ApiError(e.getMessage(), RequestCorrelation.resolveRequestId(request)));
        }
    }

    @PostMapping("/image-prompt")
    public ImagePromptResponse imagePrompt(@RequestBody ImagePromptRequest body) {
        String prompt = promptAssembler.buildImagePrompt(
                body.sceneDescription(),
                body.characters() == null ? List.of() : body.characters(),
                body.artStyle(),
                body.artBible(),
                body.characterReferences() == null ? Map.of() : body.characterReferences());
        return new ImagePromptResponse(prompt);
    }

    public record RebuildResponse(String storyId, String sessionId) {}

    public record AdoptSessionRequest(String sessionId) {}

    public record ClearSessionResponse(String storyId, boolean cleared) {}

    public record ArtBiblePromptRequest(String artStyle, String genre, String title, String additionalNotes) {}

    public record CharacterReferencePromptRequest(CharacterProfile character, String artStyle, Boolean includeTurnaround) {}

    public record ImagePromptRequest(
            String sceneDescription,
            List<CharacterProfile> characters,
            String artStyle,
            ArtBible artBible,
            Map<String, String> characterReferences
    ) {}

    public record ImagePromptResponse(String prompt) {}
}
