package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Input for a character extraction task. When {@code storyId} is set the resulting profiles are
 * saved to that story's project.
 */
public record CharacterExtractionRequest(
    @JsonAlias("story_id") String storyId,
    List<StoryPage> pages
) {}
