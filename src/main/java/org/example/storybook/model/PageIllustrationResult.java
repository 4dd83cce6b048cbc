package org.example.storybook.model;

public record PageIllustrationResult(
    String storyId,
    int pageNumber,
    String imageUrl,
    String prompt,
    String sessionId
) {}
