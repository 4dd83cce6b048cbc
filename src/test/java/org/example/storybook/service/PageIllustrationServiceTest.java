package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.PageIllustrationRequest;
import org.example.storybook.model.PageIllustrationResult;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.service.image.StubImageProvider;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.example.storybook.service.session.VisualSessionStore;
import org.example.storybook.service.task.TaskValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageIllustrationServiceTest {

    private static final String STORY_ID = "story-1";
    private static final List<CharacterProfile> CHARACTERS = List.of(
            CharacterProfile.of("Pip", "Mouse", "small grey mouse"));
    private static final SessionInputs INPUTS = new SessionInputs(
            ArtBible.ofPrompt("Soft watercolor woodland", "watercolor"), CHARACTERS, Map.of());

    @Mock
    private LlmProvider textProvider;

    @Mock
    private SessionInputService sessionInputService;

    @Mock
    private ProjectStoreService projectStore;

    private StubImageProvider imageProvider;
    private VisualConsistencySessionManager sessionManager;
    private PageIllustrationService service;

    @BeforeEach
    void setUp() {
        imageProvider = new StubImageProvider();
        ConsistencyPromptAssembler assembler = new ConsistencyPromptAssembler();
        sessionManager = new VisualConsistencySessionManager(imageProvider, assembler, new VisualSessionStore());
        service = new PageIllustrationService(textProvider, assembler, sessionManager, sessionInputService, projectStore);
    }

    @Test
    void execute_sceneDescriptionBuildsPromptInsideSession() {
        when(sessionInputService.resolve(eq(STORY_ID), isNull(), isNull(), isNull())).thenReturn(INPUTS);

        PageIllustrationResult result = service.execute(new PageIllustrationRequest(
                STORY_ID, 2, null, "Pip climbs the oak tree", null, null, null, null, null));

        assertEquals(2, result.pageNumber());
        assertTrue(result.sessionId().startsWith("stub-session-"));
        assertTrue(result.imageUrl().startsWith("https://via.placeholder.com/"));
        assertTrue(result.prompt().startsWith("A watercolor style children's book illustration"));
        assertTrue(result.prompt().contains("- Pip (a Mouse, small grey mouse"));
        assertTrue(result.prompt().endsWith("Scene: Pip climbs the oak tree"));
        verify(projectStore).updatePageImage(STORY_ID, 2, result.imageUrl(), result.prompt());
        verify(textProvider, never()).generate(anyString(), any(LlmOptions.class));
    }

    @Test
    void execute_customPromptIsSentVerbatim() {
        when(sessionInputService.resolve(eq(STORY_ID), isNull(), isNull(), isNull())).thenReturn(INPUTS);

        PageIllustrationResult result = service.execute(new PageIllustrationRequest(
                STORY_ID, 1, "ignored text", null, "  A red kite over the hills ", null, null, null, null));

        assertEquals("A red kite over the hills", result.prompt());
    }

    @Test
    void execute_secondPageReusesSession() {
        when(sessionInputService.resolve(eq(STORY_ID), isNull(), isNull(), isNull())).thenReturn(INPUTS);

        PageIllustrationResult first = service.execute(new PageIllustrationRequest(
                STORY_ID, 1, null, "Pip wakes up", null, null, null, null, null));
        PageIllustrationResult second = service.execute(new PageIllustrationRequest(
                STORY_ID, 2, null, "Pip eats breakfast", null, null, null, null, null));

        assertEquals(first.sessionId(), second.sessionId());
        assertEquals(2, imageProvider.getCallCount());
    }

    @Test
    void execute_pageTextIsSummarizedIntoScene() {
        when(sessionInputService.resolve(eq(STORY_ID), isNull(), isNull(), isNull())).thenReturn(INPUTS);
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("Pip waves from a branch.");

        PageIllustrationResult result = service.execute(new PageIllustrationRequest(
                STORY_ID, 3, "Pip was so happy that he climbed up and waved to everyone.",
                null, null, null, null, null, null));

        assertTrue(result.prompt().endsWith("Scene: Pip waves from a branch."));
    }

    @Test
    void summarizeScene_fallsBackToPageTextOnFailure() {
        when(textProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new LlmProviderException("connection refused"));
        String longText = "word ".repeat(100);

        String scene = service.summarizeScene(longText, CHARACTERS);

        assertEquals(PageIllustrationService.SCENE_FALLBACK_LENGTH, scene.length());
    }

    @Test
    void validate_requiresStoryPageAndSomethingToDraw() {
        assertThrows(TaskValidationException.class, () -> service.validate(new PageIllustrationRequest(
                null, 1, "text", null, null, null, null, null, null)));
        assertThrows(TaskValidationException.class, () -> service.validate(new PageIllustrationRequest(
                STORY_ID, 0, "text", null, null, null, null, null, null)));
        assertThrows(TaskValidationException.class, () -> service.validate(new PageIllustrationRequest(
                STORY_ID, 1, " ", null, null, null, null, null, null)));
    }
}
