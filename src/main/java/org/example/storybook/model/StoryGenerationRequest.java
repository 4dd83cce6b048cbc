package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Input for a story generation task. Only {@code title} is required; omitted fields take the
 * configured story defaults.
 */
public record StoryGenerationRequest(
    String title,
    String language,
    String complexity,
    @JsonAlias("vocabulary_diversity") String vocabularyDiversity,
    @JsonAlias("age_group") String ageGroup,
    @JsonAlias("num_pages") Integer numPages,
    String genre,
    @JsonAlias("art_style") String artStyle,
    String theme,
    @JsonAlias("custom_prompt") String customPrompt,
    @JsonAlias("words_per_page") Integer wordsPerPage
) {
    public static StoryGenerationRequest titled(String title, int numPages) {
        return new StoryGenerationRequest(title, null, null, null, null, numPages,
                null, null, null, null, null);
    }
}
