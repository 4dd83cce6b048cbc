package org.example.storybook.service;

import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.ImageHandle;
import org.example.storybook.model.PageIllustrationRequest;
import org.example.storybook.model.PageIllustrationResult;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.session.VisualSession;
import org.example.storybook.service.task.GenerationTaskHandler;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Illustrates one story page inside the story's visual session.
 */
@Service
public class PageIllustrationService implements GenerationTaskHandler<PageIllustrationRequest, PageIllustrationResult> {

    private static final Logger log = LoggerFactory.getLogger(PageIllustrationService.class);

    static final int SCENE_FALLBACK_LENGTH = 200;
    static final double SUMMARY_TEMPERATURE = 0.3;

    private static final String SCENE_SYSTEM_MESSAGE = """
            You are an expert at analyzing children's story text and identifying the main visual scene to illustrate.
            Extract the KEY VISUAL MOMENT from the story page that should be drawn.

            Focus on the main action, character positions and activities (use the exact character names and
            species provided), the setting and the emotional tone.
            Use ONLY the character information provided and do not add details that are not in the story text.
            Ignore narrative commentary, internal thoughts and abstract concepts that can't be visualized.

            Return ONLY a concise scene description (30-50 words) that an illustrator could draw.""";

    private final LlmProvider textProvider;
    private final ConsistencyPromptAssembler promptAssembler;
    private final VisualConsistencySessionManager sessionManager;
    private final SessionInputService sessionInputService;
    private final ProjectStoreService projectStore;

    public PageIllustrationService(
            @Qualifier("textLlmProvider") LlmProvider textProvider,
            ConsistencyPromptAssembler promptAssembler,
            VisualConsistencySessionManager sessionManager,
            SessionInputService sessionInputService,
            ProjectStoreService projectStore) {
        this.textProvider = textProvider;
        this.promptAssembler = promptAssembler;
        this.sessionManager = sessionManager;
        this.sessionInputService = sessionInputService;
        this.projectStore = projectStore;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PAGE_ILLUSTRATION;
    }

    @Override
    public Class<PageIllustrationRequest> inputType() {
        return PageIllustrationRequest.class;
    }

    @Override
    public void validate(PageIllustrationRequest request) {
        if (isBlank(request.storyId())) {
            throw new TaskValidationException("storyId is required");
        }
        if (request.pageNumber() == null || request.pageNumber() < 1) {
            throw new TaskValidationException("pageNumber must be 1 or greater");
        }
        if (isBlank(request.customPrompt()) && isBlank(request.sceneDescription()) && isBlank(request.pageText())) {
            throw new TaskValidationException("one of customPrompt, sceneDescription or pageText is required");
        }
    }

    @Override
    public PageIllustrationResult execute(PageIllustrationRequest request) {
        String storyId = request.storyId();
        SessionInputs inputs = sessionInputService.resolve(
                storyId, request.artBible(), request.characters(), request.artStyle());
        String sessionId = sessionManager.ensureSession(
                storyId, inputs.artBible(), inputs.characters(), inputs.referencePrompts());

        String prompt = isBlank(request.customPrompt())
                ? assemblePrompt(request, inputs)
                : request.customPrompt().trim();

        ImageHandle image = sessionManager.continueGeneration(storyId, prompt);
        projectStore.updatePageImage(storyId, request.pageNumber(), image.imageUrl(), prompt);
        log.info("Illustrated page {} of story {}", request.pageNumber(), storyId);
        return new PageIllustrationResult(storyId, request.pageNumber(), image.imageUrl(), prompt, sessionId);
    }

    private String assemblePrompt(PageIllustrationRequest request, SessionInputs inputs) {
        String scene = request.sceneDescription();
        if (isBlank(scene)) {
            scene = Boolean.FALSE.equals(request.summarizeScene())
                    ? request.pageText()
                    : summarizeScene(request.pageText(), inputs.characters());
        }
        String style = isBlank(request.artStyle()) ? inputs.artBible().artStyle() : request.artStyle();
        Map<String, String> references = sessionManager.getSession(request.storyId())
                .map(VisualSession::characterReferenceSnapshots)
                .orElse(Map.of());
        return promptAssembler.buildImagePrompt(scene, inputs.characters(), style, inputs.artBible(), references);
    }

    /**
     * Condense a page of story text into a short visual scene. Falls back to the start of the text
     * when the text provider fails.
     */
    public String summarizeScene(String pageText, List<CharacterProfile> characters) {
        String text = pageText == null ? "" : pageText.trim();
        String characterContext = "";
        if (characters != null && !characters.isEmpty()) {
            characterContext = "\n\nMain characters in this story: " + characters.stream()
                    .limit(3)
                    .map(profile -> profile.name() + (isBlank(profile.species()) ? "" : " (a " + profile.species() + ")"))
                    .collect(Collectors.joining(", "));
        }
        String prompt = String.format("""
                Analyze this children's story page and describe the main scene to illustrate:%s

                Story page text:
                %s

                Return only the scene description, nothing else.""", characterContext, text);
        try {
            String summary = textProvider.generate(prompt,
                    LlmOptions.withTemperature(SUMMARY_TEMPERATURE).withSystemMessage(SCENE_SYSTEM_MESSAGE));
            if (summary != null && !summary.isBlank()) {
                return summary.trim();
            }
            log.warn("Scene summary was empty, using page text");
        } catch (Exception e) {
            log.warn("Scene summary failed, using page text: {}", e.getMessage());
        }
        return text.length() <= SCENE_FALLBACK_LENGTH ? text : text.substring(0, SCENE_FALLBACK_LENGTH);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
