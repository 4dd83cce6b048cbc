package org.example.storybook.model;

public record CharacterReference(
    String characterName,
    String prompt,
    String imageUrl,
    String species,
    String physicalDescription,
    String clothing,
    String distinctiveFeatures
) {
    public CharacterReference withImage(String newImageUrl) {
        return new CharacterReference(characterName, prompt, newImageUrl, species,
                physicalDescription, clothing, distinctiveFeatures);
    }
}
