package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Visual profile of a story character, used to keep the character consistent across illustrations.
 * Only {@code name} is required; the remaining fields may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterProfile(
    String name,
    String species,
    @JsonAlias("physical_description") String physicalDescription,
    String clothing,
    @JsonAlias("distinctive_features") String distinctiveFeatures,
    @JsonAlias("personality_traits") String personalityTraits
) {
    public static CharacterProfile of(String name, String species, String physicalDescription) {
        return new CharacterProfile(name, species, physicalDescription, null, null, null);
    }
}
