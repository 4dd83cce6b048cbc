package org.example.storybook.model;

import java.time.LocalDateTime;
import java.util.List;

public record Story(
    String id,
    StoryMetadata metadata,
    List<StoryPage> pages,
    List<CharacterProfile> characters,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
}
