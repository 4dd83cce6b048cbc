package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.SessionInputs;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the art bible, characters and reference prompts a story's visual session is primed
 * with. Values supplied by the caller win; anything missing comes from the project store.
 */
@Service
public class SessionInputService {

    private final ProjectStoreService projectStore;
    private final ConsistencyPromptAssembler promptAssembler;
    private final String defaultArtStyle;

    public SessionInputService(
            ProjectStoreService projectStore,
            ConsistencyPromptAssembler promptAssembler,
            @Value("${story.defaults.art-style:cartoon}") String defaultArtStyle) {
        this.projectStore = projectStore;
        this.promptAssembler = promptAssembler;
        this.defaultArtStyle = defaultArtStyle;
    }

    public SessionInputs resolve(String storyId, ArtBible artBible, List<CharacterProfile> characters, String artStyle) {
        Optional<Story> story = storyId == null ? Optional.empty() : projectStore.findStory(storyId);

        ArtBible resolvedArtBible = artBible;
        if (resolvedArtBible == null && storyId != null) {
            resolvedArtBible = projectStore.findArtBible(storyId).orElse(null);
        }
        if (resolvedArtBible == null) {
            String style = firstNonBlank(artStyle,
                    storyId == null ? null : projectStore.findArtStyle(storyId).orElse(null),
                    defaultArtStyle);
            StoryMetadata metadata = story.map(Story::metadata).orElse(null);
            resolvedArtBible = promptAssembler.buildArtBible(
                    style,
                    metadata == null ? null : metadata.genre(),
                    metadata == null ? null : metadata.title(),
                    null);
        }

        List<CharacterProfile> resolvedCharacters = characters;
        if ((resolvedCharacters == null || resolvedCharacters.isEmpty()) && storyId != null) {
            resolvedCharacters = projectStore.findCharacterProfiles(storyId);
            if (resolvedCharacters.isEmpty()) {
                resolvedCharacters = story.map(Story::characters).orElse(List.of());
            }
        }

        Map<String, String> referencePrompts = new LinkedHashMap<>();
        if (storyId != null) {
            for (CharacterReference reference : projectStore.findCharacterReferences(storyId).values()) {
                if (reference.prompt() != null && !reference.prompt().isBlank()) {
                    referencePrompts.put(reference.characterName(), reference.prompt());
                }
            }
        }
        return new SessionInputs(resolvedArtBible, resolvedCharacters, referencePrompts);
    }

    /**
     * Inputs for a story that must already exist in the project store.
     */
    public Optional<SessionInputs> resolveStored(String storyId) {
        if (!projectStore.exists(storyId)) {
            return Optional.empty();
        }
        return Optional.of(resolve(storyId, null, null, null));
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "cartoon";
    }
}
