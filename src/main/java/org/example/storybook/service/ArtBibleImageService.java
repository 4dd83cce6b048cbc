package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.ArtBibleImageRequest;
import org.example.storybook.model.ImageHandle;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.service.task.GenerationTaskHandler;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Renders a story's art bible reference image in its visual session and stores the result.
 */
@Service
public class ArtBibleImageService implements GenerationTaskHandler<ArtBibleImageRequest, ArtBible> {

    private static final Logger log = LoggerFactory.getLogger(ArtBibleImageService.class);

    private final ConsistencyPromptAssembler promptAssembler;
    private final VisualConsistencySessionManager sessionManager;
    private final SessionInputService sessionInputService;
    private final ProjectStoreService projectStore;
    private final String defaultArtStyle;

    public ArtBibleImageService(
            ConsistencyPromptAssembler promptAssembler,
            VisualConsistencySessionManager sessionManager,
            SessionInputService sessionInputService,
            ProjectStoreService projectStore,
            @Value("${story.defaults.art-style:cartoon}") String defaultArtStyle) {
        this.promptAssembler = promptAssembler;
        this.sessionManager = sessionManager;
        this.sessionInputService = sessionInputService;
        this.projectStore = projectStore;
        this.defaultArtStyle = defaultArtStyle;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.ART_BIBLE_IMAGE;
    }

    @Override
    public Class<ArtBibleImageRequest> inputType() {
        return ArtBibleImageRequest.class;
    }

    @Override
    public void validate(ArtBibleImageRequest request) {
        if (request.storyId() == null || request.storyId().isBlank()) {
            throw new TaskValidationException("storyId is required");
        }
    }

    @Override
    public ArtBible execute(ArtBibleImageRequest request) {
        String storyId = request.storyId();
        StoryMetadata metadata = projectStore.findStory(storyId).map(Story::metadata).orElse(null);
        String artStyle = firstNonBlank(request.artStyle(),
                projectStore.findArtStyle(storyId).orElse(null), defaultArtStyle);
        ArtBible artBible = promptAssembler.buildArtBible(
                artStyle,
                firstNonBlank(request.genre(), metadata == null ? null : metadata.genre()),
                firstNonBlank(request.title(), metadata == null ? null : metadata.title()),
                request.additionalNotes());

        SessionInputs inputs = sessionInputService.resolve(storyId, artBible, request.characters(), artStyle);
        sessionManager.ensureSession(storyId, artBible, inputs.characters(), inputs.referencePrompts());
        ImageHandle image = sessionManager.continueGeneration(storyId, artBible.prompt());

        ArtBible rendered = artBible.withImage(image.imageUrl());
        sessionManager.recordArtBible(storyId, rendered);
        projectStore.saveArtBible(storyId, rendered);
        log.info("Generated art bible image for story {} in {} style", storyId, artStyle);
        return rendered;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
