package org.example.storybook.model;

public record StoryMetadata(
    String title,
    String language,
    String complexity,
    String vocabularyDiversity,
    String ageGroup,
    int numPages,
    String genre,
    String artStyle,
    String userPrompt,
    int wordsPerPage
) {
}
