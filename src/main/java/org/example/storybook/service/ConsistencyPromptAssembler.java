package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the exact prompt text sent to the image provider.
 * <p>
 * Every method is a pure function of its arguments: the same inputs always produce the same text.
 * Image prompts are laid out as style framing, then the character block in the order the
 * characters were introduced, then the scene. Session rebuilds replay the priming prompt built
 * here, so changing the layout changes what a rebuilt session looks like.
 */
@Service
public class ConsistencyPromptAssembler {

    static final int MAX_IMAGE_PROMPT_LENGTH = 4000;
    static final int MAX_SCENE_LENGTH = 400;
    static final int MAX_PHYSICAL_DESCRIPTION_LENGTH = 100;
    static final int MAX_DETAIL_LENGTH = 60;
    static final int MAX_ART_BIBLE_EXCERPT_LENGTH = 300;

    private static final String DEFAULT_ART_STYLE = "cartoon";

    /**
     * Build the prompt for one illustration.
     *
     * @param sceneDescription    what happens in the picture
     * @param characterProfiles   characters in story-introduction order; may be empty
     * @param styleDescriptor     art style, e.g. "watercolor"; falls back to the art bible's style
     * @param artBible            optional style reference
     * @param characterReferences optional character name to reference prompt snapshots
     */
    public String buildImagePrompt(
            String sceneDescription,
            List<CharacterProfile> characterProfiles,
            String styleDescriptor,
            ArtBible artBible,
            Map<String, String> characterReferences) {

        List<String> blocks = new ArrayList<>();
        blocks.add(styleBlock(resolveStyle(styleDescriptor, artBible), artBible));

        String characterBlock = characterBlock(characterProfiles, characterReferences);
        if (!characterBlock.isEmpty()) {
            blocks.add(characterBlock);
        }

        blocks.add("Scene: " + smartTruncate(nullToEmpty(sceneDescription).trim(), MAX_SCENE_LENGTH));

        String prompt = String.join("\n\n", blocks);
        if (prompt.length() > MAX_IMAGE_PROMPT_LENGTH) {
            prompt = prompt.substring(0, MAX_IMAGE_PROMPT_LENGTH - 3) + "...";
        }
        return prompt;
    }

    public String buildImagePrompt(String sceneDescription, List<CharacterProfile> characterProfiles, String styleDescriptor) {
        return buildImagePrompt(sceneDescription, characterProfiles, styleDescriptor, null, Map.of());
    }

    /**
     * Build the priming turn for a new image conversation, using a reference prompt generated
     * from each profile.
     */
    public String buildPrimingPrompt(ArtBible artBible, List<CharacterProfile> characterProfiles) {
        return buildPrimingPrompt(artBible, characterProfiles, Map.of());
    }

    /**
     * Build the priming turn for a new image conversation.
     *
     * @param referencePrompts reference prompt per character name; characters missing from the map
     *                         get a prompt generated from their profile
     */
    public String buildPrimingPrompt(
            ArtBible artBible,
            List<CharacterProfile> characterProfiles,
            Map<String, String> referencePrompts) {

        String artStyle = resolveStyle(null, artBible);
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert children's book illustrator creating illustrations for a story.\n\n");
        prompt.append("Art Style: ").append(artStyle).append("\n");

        if (artBible != null) {
            appendLine(prompt, "Art Bible: ", artBible.prompt());
            appendLine(prompt, "Style Notes: ", artBible.styleNotes());
            appendLine(prompt, "Color Palette: ", artBible.colorPalette());
            appendLine(prompt, "Lighting: ", artBible.lightingStyle());
            appendLine(prompt, "Brush Technique: ", artBible.brushTechnique());
        }

        Map<String, String> references = characterReferencePrompts(characterProfiles, artStyle, referencePrompts);
        if (!references.isEmpty()) {
            prompt.append("\nCharacter References:\n");
            int index = 1;
            for (Map.Entry<String, String> entry : references.entrySet()) {
                prompt.append(index++).append(". ").append(entry.getKey()).append(": ")
                        .append(entry.getValue()).append("\n");
            }
        }

        prompt.append("""

                IMPORTANT GUIDELINES:
                - All images must maintain perfect visual consistency throughout the story
                - Characters must look EXACTLY the same in every illustration
                - The art style, colors, and techniques must remain consistent
                - When I reference "the art bible" or "previously created characters", use them exactly as designed

                Respond briefly to acknowledge you're ready, then wait for my requests.""");
        return prompt.toString();
    }

    /**
     * Reference prompts for each character in profile order, preferring the supplied snapshots.
     */
    public Map<String, String> characterReferencePrompts(
            List<CharacterProfile> characterProfiles,
            String artStyle,
            Map<String, String> snapshots) {

        Map<String, String> references = new LinkedHashMap<>();
        if (characterProfiles == null) {
            return references;
        }
        for (CharacterProfile profile : characterProfiles) {
            String name = displayName(profile);
            if (name.isEmpty() || references.containsKey(name)) {
                continue;
            }
            String snapshot = snapshots == null ? null : snapshots.get(name);
            references.put(name, isBlank(snapshot)
                    ? buildCharacterReference(profile, artStyle, false).prompt()
                    : snapshot);
        }
        return references;
    }

    /**
     * Build the art bible for a book: the prompt for its style reference image.
     */
    public ArtBible buildArtBible(String artStyle, String genre, String storyTitle, String additionalNotes) {
        if (isBlank(artStyle)) {
            throw new IllegalArgumentException("art_style is required to build an art bible");
        }
        StringBuilder prompt = new StringBuilder();
        prompt.append("Create an art bible reference sheet for a ");
        if (!isBlank(genre)) {
            prompt.append(genre.trim()).append(" ");
        }
        prompt.append("children's book");
        if (!isBlank(storyTitle)) {
            prompt.append(" titled \"").append(storyTitle.trim()).append("\"");
        }
        prompt.append(" in a ").append(artStyle.trim()).append(" style. ");
        prompt.append("Show one representative scene together with color palette swatches, ");
        prompt.append("lighting examples and brush or texture samples that define the book's visual language. ");
        prompt.append("No text or lettering.");
        if (!isBlank(additionalNotes)) {
            prompt.append(" Additional notes: ").append(additionalNotes.trim());
        }
        return new ArtBible(prompt.toString(), artStyle.trim(), null, null,
                isBlank(additionalNotes) ? null : additionalNotes.trim(), null, null, null);
    }

    /**
     * Build the reference sheet prompt for one character.
     *
     * @param includeTurnaround show front, side and back views instead of a single pose
     */
    public CharacterReference buildCharacterReference(CharacterProfile profile, String artStyle, boolean includeTurnaround) {
        if (profile == null || isBlank(profile.name())) {
            throw new IllegalArgumentException("character name is required to build a character reference");
        }
        String style = isBlank(artStyle) ? DEFAULT_ART_STYLE : artStyle.trim();

        StringBuilder prompt = new StringBuilder();
        prompt.append("Character reference sheet for ").append(profile.name().trim());
        if (!isBlank(profile.species())) {
            prompt.append(", ").append(withArticle(profile.species().trim()));
        }
        prompt.append(", in a ").append(style).append(" style.");
        appendSentence(prompt, "", profile.physicalDescription());
        appendSentence(prompt, "Distinctive features: ", profile.distinctiveFeatures());
        appendSentence(prompt, "Clothing: ", profile.clothing());
        appendSentence(prompt, "Personality: ", profile.personalityTraits());
        if (includeTurnaround) {
            prompt.append(" Show front, side and back views side by side on a plain background.");
        } else {
            prompt.append(" Show a single full-body view on a plain background.");
        }
        prompt.append(" Keep proportions and colors exactly consistent.");

        return new CharacterReference(
                profile.name().trim(),
                prompt.toString(),
                null,
                profile.species(),
                profile.physicalDescription(),
                profile.clothing(),
                profile.distinctiveFeatures()
        );
    }

    private String styleBlock(String style, ArtBible artBible) {
        StringBuilder block = new StringBuilder();
        block.append(capitalize(withArticle(style))).append(" style children's book illustration. ");
        block.append("Vibrant colors, child-friendly, professional children's book illustration style.");
        if (artBible != null) {
            if (!isBlank(artBible.prompt())) {
                block.append("\nFollow the art bible: ")
                        .append(smartTruncate(artBible.prompt().trim(), MAX_ART_BIBLE_EXCERPT_LENGTH));
            }
            appendLine(block, "\nColor palette: ", artBible.colorPalette());
            appendLine(block, "\nLighting: ", artBible.lightingStyle());
            appendLine(block, "\nBrush technique: ", artBible.brushTechnique());
        }
        return block.toString().stripTrailing();
    }

    private String characterBlock(List<CharacterProfile> characterProfiles, Map<String, String> characterReferences) {
        if (characterProfiles == null || characterProfiles.isEmpty()) {
            return "";
        }
        List<String> entries = new ArrayList<>();
        for (CharacterProfile profile : characterProfiles) {
            String entry = characterEntry(profile, characterReferences);
            if (!entry.isEmpty()) {
                entries.add("- " + entry);
            }
        }
        if (entries.isEmpty()) {
            return "";
        }
        return "Characters:\n" + String.join("\n", entries);
    }

    private String characterEntry(CharacterProfile profile, Map<String, String> characterReferences) {
        if (profile == null) {
            return "";
        }
        String name = displayName(profile);
        List<String> details = new ArrayList<>();
        if (!isBlank(profile.species())) {
            details.add(withArticle(profile.species().trim()));
        }
        addDetail(details, profile.physicalDescription(), MAX_PHYSICAL_DESCRIPTION_LENGTH);
        addDetail(details, profile.distinctiveFeatures(), MAX_DETAIL_LENGTH);
        addDetail(details, profile.clothing(), MAX_DETAIL_LENGTH);
        addDetail(details, profile.personalityTraits(), MAX_DETAIL_LENGTH);

        if (name.isEmpty() && details.isEmpty()) {
            return "";
        }

        StringBuilder entry = new StringBuilder(name.isEmpty() ? "Unnamed character" : name);
        if (!details.isEmpty()) {
            entry.append(" (").append(String.join(", ", details)).append(")");
        }
        if (!name.isEmpty() && characterReferences != null && !isBlank(characterReferences.get(name))) {
            entry.append(", drawn exactly as in their character reference sheet");
        }
        return entry.toString();
    }

    private void addDetail(List<String> details, String value, int maxLength) {
        if (!isBlank(value)) {
            details.add(smartTruncate(value.trim(), maxLength));
        }
    }

    private String resolveStyle(String styleDescriptor, ArtBible artBible) {
        if (!isBlank(styleDescriptor)) {
            return styleDescriptor.trim();
        }
        if (artBible != null && !isBlank(artBible.artStyle())) {
            return artBible.artStyle().trim();
        }
        return DEFAULT_ART_STYLE;
    }

    private void appendLine(StringBuilder builder, String label, String value) {
        if (!isBlank(value)) {
            builder.append(label).append(value.trim());
            if (!label.startsWith("\n")) {
                builder.append("\n");
            }
        }
    }

    private void appendSentence(StringBuilder builder, String label, String value) {
        if (isBlank(value)) {
            return;
        }
        String text = value.trim();
        builder.append(" ").append(label).append(text);
        if (!text.endsWith(".")) {
            builder.append(".");
        }
    }

    private String displayName(CharacterProfile profile) {
        return profile == null || profile.name() == null ? "" : profile.name().trim();
    }

    private static String withArticle(String noun) {
        if (noun.isEmpty()) {
            return noun;
        }
        char first = Character.toLowerCase(noun.charAt(0));
        String article = "aeiou".indexOf(first) >= 0 ? "an " : "a ";
        return article + noun;
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    /**
     * Truncate without cutting a word in half.
     */
    static String smartTruncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        String truncated = text.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');
        return lastSpace > 0 ? truncated.substring(0, lastSpace) : truncated;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
