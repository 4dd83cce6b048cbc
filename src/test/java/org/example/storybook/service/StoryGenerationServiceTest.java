package org.example.storybook.service;

import org.example.storybook.model.Story;
import org.example.storybook.model.StoryGenerationRequest;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.example.storybook.service.task.TaskValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoryGenerationServiceTest {

    @Mock
    private LlmProvider textProvider;

    @Mock
    private ProjectStoreService projectStore;

    private StoryGenerationService service;

    @BeforeEach
    void setUp() {
        service = new StoryGenerationService(textProvider, projectStore);
    }

    @Test
    void generateStory_splitsPagesAndSavesProject() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("""
                The Brave Little Mouse

                Page 1: Pip lived under a big oak tree.
                Page 2: One morning Pip heard a strange noise.
                Page 3: It was only Ollie the owl, saying hello.""");

        Story story = service.generateStory(StoryGenerationRequest.titled("The Brave Little Mouse", 3));

        assertEquals(3, story.pages().size());
        assertEquals("Pip lived under a big oak tree.", story.pages().get(0).text());
        assertEquals(3, story.pages().get(2).pageNumber());
        assertNull(story.pages().get(0).imageUrl());
        assertEquals("cartoon", story.metadata().artStyle());
        verify(projectStore).saveStory(story);
    }

    @Test
    void generateStory_usesConfiguredTemperatureAndTokenCap() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("Page 1: Hello.");

        StoryGenerationRequest request = new StoryGenerationRequest("Hello", "Spanish", null, null, null,
                20, null, null, null, null, 200);
        service.generateStory(request);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<LlmOptions> options = ArgumentCaptor.forClass(LlmOptions.class);
        verify(textProvider).generate(prompt.capture(), options.capture());
        assertEquals(0.8, options.getValue().temperature());
        assertEquals(8000, options.getValue().maxTokens());
        assertTrue(prompt.getValue().contains("children's story in Spanish"));
        assertTrue(prompt.getValue().contains("exactly 20 pages"));
    }

    @Test
    void generateStory_withoutPageMarkersFails() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("Once upon a time there was a mouse.");

        assertThrows(LlmProviderException.class,
                () -> service.generateStory(StoryGenerationRequest.titled("No Pages", 2)));
        verify(projectStore, never()).saveStory(any());
    }

    @Test
    void generateStory_emptyResponseFails() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("  ");

        assertThrows(LlmProviderException.class,
                () -> service.generateStory(StoryGenerationRequest.titled("Silence", 2)));
    }

    @Test
    void parseStoryPages_handlesSpanishMarkersAndDropsEmptyPages() {
        List<StoryPage> pages = StoryGenerationService.parseStoryPages(
                "Título\nPágina 1: Había una vez.\nPAGE 2:\nPágina 3: Fin.");

        assertEquals(2, pages.size());
        assertEquals(1, pages.get(0).pageNumber());
        assertEquals("Había una vez.", pages.get(0).text());
        assertEquals(3, pages.get(1).pageNumber());
    }

    @Test
    void maxTokensFor_clampsToBounds() {
        assertEquals(1000, StoryGenerationService.maxTokensFor(metadata(1, 10)));
        assertEquals(1125, StoryGenerationService.maxTokensFor(metadata(10, 50)));
        assertEquals(8000, StoryGenerationService.maxTokensFor(metadata(30, 500)));
    }

    @Test
    void validate_rejectsMissingTitleAndOutOfRangePages() {
        assertThrows(TaskValidationException.class, () -> service.validate(StoryGenerationRequest.titled(null, 5)));
        assertThrows(TaskValidationException.class, () -> service.validate(StoryGenerationRequest.titled("T", 0)));
        assertThrows(TaskValidationException.class, () -> service.validate(StoryGenerationRequest.titled("T", 31)));
        assertDoesNotThrow(() -> service.validate(StoryGenerationRequest.titled("T", 30)));
    }

    private static StoryMetadata metadata(int pages, int wordsPerPage) {
        return new StoryMetadata("T", "English", "simple", "moderate", "4-6", pages, null, "cartoon", null, wordsPerPage);
    }
}
