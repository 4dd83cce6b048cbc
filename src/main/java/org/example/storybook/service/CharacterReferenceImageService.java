package org.example.storybook.service;

import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.CharacterReferenceImageRequest;
import org.example.storybook.model.ImageHandle;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.service.task.GenerationTaskHandler;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders a character reference sheet in the story's visual session and stores the result.
 */
@Service
public class CharacterReferenceImageService
        implements GenerationTaskHandler<CharacterReferenceImageRequest, CharacterReference> {

    private static final Logger log = LoggerFactory.getLogger(CharacterReferenceImageService.class);

    private final ConsistencyPromptAssembler promptAssembler;
    private final VisualConsistencySessionManager sessionManager;
    private final SessionInputService sessionInputService;
    private final ProjectStoreService projectStore;

    public CharacterReferenceImageService(
            ConsistencyPromptAssembler promptAssembler,
            VisualConsistencySessionManager sessionManager,
            SessionInputService sessionInputService,
            ProjectStoreService projectStore) {
        this.promptAssembler = promptAssembler;
        this.sessionManager = sessionManager;
        this.sessionInputService = sessionInputService;
        this.projectStore = projectStore;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CHARACTER_REFERENCE_IMAGE;
    }

    @Override
    public Class<CharacterReferenceImageRequest> inputType() {
        return CharacterReferenceImageRequest.class;
    }

    @Override
    public void validate(CharacterReferenceImageRequest request) {
        if (request.storyId() == null || request.storyId().isBlank()) {
            throw new TaskValidationException("storyId is required");
        }
        if (request.character() == null || request.character().name() == null || request.character().name().isBlank()) {
            throw new TaskValidationException("character.name is required");
        }
    }

    @Override
    public CharacterReference execute(CharacterReferenceImageRequest request) {
        String storyId = request.storyId();
        SessionInputs inputs = sessionInputService.resolve(
                storyId, request.artBible(), request.characters(), request.artStyle());
        String artStyle = request.artStyle() == null || request.artStyle().isBlank()
                ? inputs.artBible().artStyle()
                : request.artStyle();
        boolean turnaround = !Boolean.FALSE.equals(request.includeTurnaround());
        CharacterReference reference = promptAssembler.buildCharacterReference(request.character(), artStyle, turnaround);

        sessionManager.ensureSession(storyId, inputs.artBible(), inputs.characters(), inputs.referencePrompts());
        ImageHandle image = sessionManager.continueGeneration(storyId, reference.prompt());

        CharacterReference rendered = reference.withImage(image.imageUrl());
        sessionManager.recordCharacterReference(storyId, rendered.characterName(), rendered.prompt());
        projectStore.saveCharacterReference(storyId, rendered);
        log.info("Generated character reference for '{}' in story {}", rendered.characterName(), storyId);
        return rendered;
    }
}
