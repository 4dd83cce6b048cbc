package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Input for a page illustration task.
 * <p>
 * {@code customPrompt}, when present, is sent as-is. Otherwise the prompt is assembled from
 * {@code sceneDescription} (or the page text, optionally summarized) plus the characters and style.
 * Art bible and characters fall back to the stored project when omitted.
 */
public record PageIllustrationRequest(
    @JsonAlias("story_id") String storyId,
    @JsonAlias("page_number") Integer pageNumber,
    @JsonAlias("page_text") String pageText,
    @JsonAlias("scene_description") String sceneDescription,
    @JsonAlias("custom_prompt") String customPrompt,
    @JsonAlias("art_style") String artStyle,
    @JsonAlias("art_bible") ArtBible artBible,
    List<CharacterProfile> characters,
    @JsonAlias("summarize_scene") Boolean summarizeScene
) {}
