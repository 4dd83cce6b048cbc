package org.example.storybook.service;

import org.example.storybook.model.Story;
import org.example.storybook.model.StoryGenerationRequest;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.example.storybook.service.task.GenerationTaskHandler;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a story with the text provider and splits it into pages.
 */
@Service
public class StoryGenerationService implements GenerationTaskHandler<StoryGenerationRequest, Story> {

    private static final Logger log = LoggerFactory.getLogger(StoryGenerationService.class);

    static final int MIN_PAGES = 1;
    static final int MAX_PAGES = 30;
    static final double STORY_TEMPERATURE = 0.8;
    static final int MIN_MAX_TOKENS = 1000;
    static final int MAX_MAX_TOKENS = 8000;

    private static final Pattern PAGE_MARKER = Pattern.compile(
            "(?:Page|Página)\\s+(\\d{1,4}):\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final LlmProvider textProvider;
    private final ProjectStoreService projectStore;

    @Value("${story.defaults.language:English}")
    private String defaultLanguage = "English";

    @Value("${story.defaults.complexity:simple}")
    private String defaultComplexity = "simple";

    @Value("${story.defaults.vocabulary-diversity:moderate}")
    private String defaultVocabularyDiversity = "moderate";

    @Value("${story.defaults.age-group:4-6}")
    private String defaultAgeGroup = "4-6";

    @Value("${story.defaults.num-pages:5}")
    private int defaultNumPages = 5;

    @Value("${story.defaults.genre:}")
    private String defaultGenre = "";

    @Value("${story.defaults.art-style:cartoon}")
    private String defaultArtStyle = "cartoon";

    @Value("${story.defaults.words-per-page:50}")
    private int defaultWordsPerPage = 50;

    public StoryGenerationService(
            @Qualifier("textLlmProvider") LlmProvider textProvider,
            ProjectStoreService projectStore) {
        this.textProvider = textProvider;
        this.projectStore = projectStore;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.STORY_GENERATION;
    }

    @Override
    public Class<StoryGenerationRequest> inputType() {
        return StoryGenerationRequest.class;
    }

    @Override
    public void validate(StoryGenerationRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new TaskValidationException("title is required");
        }
        if (request.numPages() != null && (request.numPages() < MIN_PAGES || request.numPages() > MAX_PAGES)) {
            throw new TaskValidationException("numPages must be between " + MIN_PAGES + " and " + MAX_PAGES);
        }
        if (request.wordsPerPage() != null && request.wordsPerPage() < 1) {
            throw new TaskValidationException("wordsPerPage must be positive");
        }
    }

    @Override
    public Story execute(StoryGenerationRequest request) {
        return generateStory(request);
    }

    public Story generateStory(StoryGenerationRequest request) {
        StoryMetadata metadata = toMetadata(request);
        String prompt = buildStoryPrompt(metadata, request.theme(), request.customPrompt());
        int maxTokens = maxTokensFor(metadata);

        log.info("Generating story '{}': {} pages x {} words, maxTokens={}",
                metadata.title(), metadata.numPages(), metadata.wordsPerPage(), maxTokens);
        String storyText = textProvider.generate(prompt,
                LlmOptions.withTemperatureAndMaxTokens(STORY_TEMPERATURE, maxTokens));
        if (storyText == null || storyText.isBlank()) {
            throw new LlmProviderException("Text provider returned an empty story");
        }

        List<StoryPage> pages = parseStoryPages(storyText);
        if (pages.isEmpty()) {
            log.warn("No page markers found in generated story for '{}'", metadata.title());
            throw new LlmProviderException("Generated story did not contain any pages");
        }
        if (pages.size() != metadata.numPages()) {
            log.warn("Requested {} pages for '{}' but parsed {}", metadata.numPages(), metadata.title(), pages.size());
        }

        LocalDateTime now = LocalDateTime.now();
        Story story = new Story(UUID.randomUUID().toString(), metadata, pages, List.of(), now, now);
        projectStore.saveStory(story);
        log.info("Generated story {} with {} pages", story.id(), pages.size());
        return story;
    }

    StoryMetadata toMetadata(StoryGenerationRequest request) {
        return new StoryMetadata(
                request.title().trim(),
                orDefault(request.language(), defaultLanguage),
                orDefault(request.complexity(), defaultComplexity),
                orDefault(request.vocabularyDiversity(), defaultVocabularyDiversity),
                orDefault(request.ageGroup(), defaultAgeGroup),
                request.numPages() != null ? request.numPages() : defaultNumPages,
                orDefault(request.genre(), defaultGenre.isBlank() ? null : defaultGenre),
                orDefault(request.artStyle(), defaultArtStyle),
                request.customPrompt(),
                request.wordsPerPage() != null ? request.wordsPerPage() : defaultWordsPerPage
        );
    }

    String buildStoryPrompt(StoryMetadata metadata, String theme, String customPrompt) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format("Write a %s children's story in %s for ages %s.",
                metadata.complexity(), metadata.language(), metadata.ageGroup()));
        parts.add(String.format("The title of the story is \"%s\".", metadata.title()));
        parts.add(String.format(
                "The story should have exactly %d pages, with each page containing about %d words appropriate for the age group.",
                metadata.numPages(), metadata.wordsPerPage()));
        if (metadata.genre() != null && !metadata.genre().isBlank()) {
            parts.add("Genre: " + metadata.genre() + ".");
        }
        if (theme != null && !theme.isBlank()) {
            parts.add("Theme: " + theme.trim() + ".");
        }
        if (customPrompt != null && !customPrompt.isBlank()) {
            parts.add("Story idea: " + customPrompt.trim() + ".");
        }
        parts.add(String.format("Use %s vocabulary appropriate for the %s age group.",
                metadata.vocabularyDiversity(), metadata.ageGroup()));
        parts.add("""


                Format the story with clear page breaks. For each page, write:
                Page X:
                [Story text for that page]

                Make the story engaging, age-appropriate, and complete within the specified number of pages.""");
        return String.join(" ", parts);
    }

    static int maxTokensFor(StoryMetadata metadata) {
        int totalWords = metadata.numPages() * metadata.wordsPerPage();
        int maxTokens = (int) (totalWords * 1.5 * 1.5);
        return Math.max(MIN_MAX_TOKENS, Math.min(maxTokens, MAX_MAX_TOKENS));
    }

    /**
     * Split generated text on "Page N:" (or "Página N:") markers. Text before the first marker and
     * pages with no text are dropped.
     */
    static List<StoryPage> parseStoryPages(String storyText) {
        List<StoryPage> pages = new ArrayList<>();
        Matcher matcher = PAGE_MARKER.matcher(storyText);
        Integer currentPage = null;
        int textStart = 0;
        while (matcher.find()) {
            if (currentPage != null) {
                addPage(pages, currentPage, storyText.substring(textStart, matcher.start()));
            }
            currentPage = Integer.parseInt(matcher.group(1));
            textStart = matcher.end();
        }
        if (currentPage != null) {
            addPage(pages, currentPage, storyText.substring(textStart));
        }
        return pages;
    }

    private static void addPage(List<StoryPage> pages, int pageNumber, String rawText) {
        String text = rawText.strip();
        if (!text.isEmpty()) {
            pages.add(StoryPage.of(pageNumber, text));
        }
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
