package org.example.storybook.model;

import java.util.List;
import java.util.Map;

/**
 * Durable inputs a visual session can be rebuilt from.
 */
public record SessionInputs(
    ArtBible artBible,
    List<CharacterProfile> characters,
    Map<String, String> referencePrompts
) {
    public SessionInputs {
        characters = characters == null ? List.of() : List.copyOf(characters);
        referencePrompts = referencePrompts == null ? Map.of() : referencePrompts;
    }
}
