package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

public record CharacterReferenceImageRequest(
    @JsonAlias("story_id") String storyId,
    CharacterProfile character,
    @JsonAlias("art_style") String artStyle,
    @JsonAlias("include_turnaround") Boolean includeTurnaround,
    @JsonAlias("art_bible") ArtBible artBible,
    List<CharacterProfile> characters
) {}
