package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencyPromptAssemblerTest {

    private final ConsistencyPromptAssembler assembler = new ConsistencyPromptAssembler();

    private static final CharacterProfile PIP = new CharacterProfile(
            "Pip", "Mouse", "small grey mouse with round ears", "red scarf", "a white patch over one eye", "brave");
    private static final CharacterProfile OLLIE = CharacterProfile.of("Ollie", "Owl", "tall brown owl");

    @Test
    void buildImagePrompt_sameInputs_produceIdenticalText() {
        ArtBible artBible = new ArtBible("Soft pastel forest scenes", "watercolor", null, null,
                null, "pastel greens", "morning light", "wet-on-wet");

        String first = assembler.buildImagePrompt("Pip climbs a tall oak", List.of(PIP, OLLIE), "watercolor",
                artBible, Map.of("Pip", "Pip reference sheet"));
        String second = assembler.buildImagePrompt("Pip climbs a tall oak", List.of(PIP, OLLIE), "watercolor",
                artBible, Map.of("Pip", "Pip reference sheet"));

        assertEquals(first, second);
    }

    @Test
    void buildImagePrompt_ordersStyleThenCharactersThenScene() {
        String prompt = assembler.buildImagePrompt("Pip and Ollie watch the stars", List.of(PIP, OLLIE), "cartoon");

        int style = prompt.indexOf("A cartoon style children's book illustration");
        int characters = prompt.indexOf("Characters:");
        int pip = prompt.indexOf("- Pip");
        int ollie = prompt.indexOf("- Ollie");
        int scene = prompt.indexOf("Scene: Pip and Ollie watch the stars");

        assertEquals(0, style);
        assertTrue(style < characters);
        assertTrue(characters < pip);
        assertTrue(pip < ollie, "characters keep introduction order");
        assertTrue(ollie < scene);
    }

    @Test
    void buildImagePrompt_omitsMissingOptionalFields() {
        String prompt = assembler.buildImagePrompt("Ollie hoots", List.of(OLLIE), "cartoon");

        assertTrue(prompt.contains("- Ollie (an Owl, tall brown owl)"));
        assertFalse(prompt.contains("null"));
        assertFalse(prompt.contains("Clothing"));
    }

    @Test
    void buildImagePrompt_withoutCharacters_hasNoCharacterBlock() {
        String prompt = assembler.buildImagePrompt("A misty valley at dawn", List.of(), "watercolor");

        assertFalse(prompt.contains("Characters:"));
        assertTrue(prompt.startsWith("A watercolor style children's book illustration"));
        assertTrue(prompt.endsWith("Scene: A misty valley at dawn"));
    }

    @Test
    void buildImagePrompt_fallsBackToArtBibleStyle() {
        ArtBible artBible = ArtBible.ofPrompt("Bold ink outlines", "comic");

        String prompt = assembler.buildImagePrompt("A race", List.of(), null, artBible, null);

        assertTrue(prompt.startsWith("A comic style children's book illustration"));
        assertTrue(prompt.contains("Follow the art bible: Bold ink outlines"));
    }

    @Test
    void buildImagePrompt_marksCharactersWithReferenceSheets() {
        String prompt = assembler.buildImagePrompt("Pip waves", List.of(PIP, OLLIE), "cartoon", null,
                Map.of("Pip", "reference"));

        assertTrue(prompt.contains("Pip (a Mouse"));
        assertTrue(prompt.contains("drawn exactly as in their character reference sheet"));
        assertEquals(1, prompt.split("character reference sheet", -1).length - 1);
    }

    @Test
    void buildPrimingPrompt_listsCharacterReferencesInOrder() {
        ArtBible artBible = new ArtBible("Gentle watercolor forest", "watercolor", null, null,
                "Loose edges", "greens", null, null);

        String prompt = assembler.buildPrimingPrompt(artBible, List.of(PIP, OLLIE),
                Map.of("Ollie", "Ollie custom reference"));

        assertTrue(prompt.contains("Art Style: watercolor"));
        assertTrue(prompt.contains("Art Bible: Gentle watercolor forest"));
        assertTrue(prompt.contains("Style Notes: Loose edges"));
        assertTrue(prompt.indexOf("1. Pip: Character reference sheet for Pip") < prompt.indexOf("2. Ollie: Ollie custom reference"));
        assertTrue(prompt.contains("Respond briefly to acknowledge you're ready"));
        assertEquals(prompt, assembler.buildPrimingPrompt(artBible, List.of(PIP, OLLIE),
                Map.of("Ollie", "Ollie custom reference")));
    }

    @Test
    void buildArtBible_requiresArtStyle() {
        assertThrows(IllegalArgumentException.class, () -> assembler.buildArtBible(" ", "fantasy", "Title", null));
    }

    @Test
    void buildArtBible_includesGenreTitleAndNotes() {
        ArtBible artBible = assembler.buildArtBible("watercolor", "adventure", "The Brave Little Mouse", "warm tones");

        assertEquals("watercolor", artBible.artStyle());
        assertTrue(artBible.prompt().contains("adventure children's book titled \"The Brave Little Mouse\" in a watercolor style"));
        assertTrue(artBible.prompt().endsWith("Additional notes: warm tones"));
        assertEquals("warm tones", artBible.styleNotes());
        assertNull(artBible.imageUrl());
    }

    @Test
    void buildCharacterReference_turnaroundChangesLayoutOnly() {
        CharacterReference turnaround = assembler.buildCharacterReference(PIP, "cartoon", true);
        CharacterReference single = assembler.buildCharacterReference(PIP, "cartoon", false);

        assertEquals("Pip", turnaround.characterName());
        assertTrue(turnaround.prompt().startsWith("Character reference sheet for Pip, a Mouse, in a cartoon style."));
        assertTrue(turnaround.prompt().contains("Distinctive features: a white patch over one eye."));
        assertTrue(turnaround.prompt().contains("front, side and back views"));
        assertTrue(single.prompt().contains("single full-body view"));
        assertEquals("red scarf", single.clothing());
    }

    @Test
    void buildCharacterReference_requiresName() {
        CharacterProfile unnamed = CharacterProfile.of(" ", "Cat", "orange cat");
        assertThrows(IllegalArgumentException.class, () -> assembler.buildCharacterReference(unnamed, "cartoon", true));
    }

    @Test
    void smartTruncate_cutsAtWordBoundary() {
        assertEquals("the quick", ConsistencyPromptAssembler.smartTruncate("the quick brown fox", 12));
        assertEquals("short", ConsistencyPromptAssembler.smartTruncate("short", 12));
    }
}
