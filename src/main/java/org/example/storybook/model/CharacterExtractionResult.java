package org.example.storybook.model;

import java.util.List;

public record CharacterExtractionResult(
    String storyId,
    List<CharacterProfile> characters
) {}
