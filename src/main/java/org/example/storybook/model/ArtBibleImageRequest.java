package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

public record ArtBibleImageRequest(
    @JsonAlias("story_id") String storyId,
    @JsonAlias("art_style") String artStyle,
    String genre,
    String title,
    @JsonAlias("additional_notes") String additionalNotes,
    List<CharacterProfile> characters
) {}
