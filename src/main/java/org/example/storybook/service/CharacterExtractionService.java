package org.example.storybook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.CharacterExtractionRequest;
import org.example.storybook.model.CharacterExtractionResult;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.example.storybook.service.task.GenerationTaskHandler;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the characters in a story and builds an illustration profile for each one.
 */
@Service
public class CharacterExtractionService
        implements GenerationTaskHandler<CharacterExtractionRequest, CharacterExtractionResult> {

    private static final Logger log = LoggerFactory.getLogger(CharacterExtractionService.class);

    static final double EXTRACTION_TEMPERATURE = 0.3;

    private static final Set<String> GENERIC_SPECIES = Set.of(
            "", "character", "creature", "being", "figure", "protagonist", "main character",
            "personaje", "criatura", "ser");

    private static final List<Pattern> SPECIES_PATTERNS = List.of(
            // people
            Pattern.compile("\\b(human|boy|girl|man|woman|child|baby|kid|person|adult|teenager|elder|grandmother|grandfather|mother|father|sister|brother|niño|niña|hombre|mujer|bebé|persona|abuela|abuelo|madre|padre|hermana|hermano)\\b"),
            // animals
            Pattern.compile("\\b(cat|dog|bird|fox|rabbit|mouse|elephant|lion|tiger|bear|wolf|deer|horse|fish|cow|pig|sheep|goat|chicken|duck|rooster|squirrel|raccoon|skunk|hedgehog|hamster|gato|perro|pájaro|zorro|conejo|ratón|elefante|león|tigre|oso|lobo|ciervo|caballo|pez|vaca|cerdo|oveja|cabra|gallina|pato|gallo|ardilla|mapache|erizo)\\b"),
            // fantasy
            Pattern.compile("\\b(dragon|unicorn|fairy|mermaid|giant|troll|elf|wizard|witch|goblin|ogre|phoenix|griffin|centaur|pegasus|dragón|unicornio|hada|sirena|gigante|duende|elfo|mago|bruja)\\b"),
            // insects and small creatures
            Pattern.compile("\\b(butterfly|bee|ant|spider|snake|frog|turtle|snail|worm|caterpillar|ladybug|dragonfly|grasshopper|cricket|firefly|beetle|mariposa|abeja|hormiga|araña|serpiente|rana|tortuga|caracol|gusano|oruga|mariquita)\\b"),
            // birds
            Pattern.compile("\\b(owl|eagle|penguin|parrot|sparrow|crow|raven|swan|flamingo|peacock|toucan|pelican|seagull|pigeon|dove|hummingbird|búho|águila|pingüino|loro|cuervo|cisne|paloma|colibrí)\\b"),
            // sea creatures
            Pattern.compile("\\b(dolphin|whale|shark|octopus|crab|jellyfish|starfish|seahorse|seal|walrus|otter|delfín|ballena|tiburón|pulpo|cangrejo|medusa|foca|nutria)\\b"),
            // primates
            Pattern.compile("\\b(monkey|ape|gorilla|chimpanzee|orangutan|mono|gorila)\\b")
    );

    private static final String EXTRACTION_SYSTEM_MESSAGE = """
            You are a character extraction specialist for children's stories.
            Your task is to identify all characters in the story and provide a brief description of each.

            Return your response as valid JSON in this EXACT format:
            {
                "characters": [
                    {
                        "name": "Character Name",
                        "description": "Brief physical description"
                    }
                ]
            }

            Guidelines:
            - Include ALL characters mentioned in the story
            - Keep descriptions concise but visually descriptive
            - Focus on physical appearance (species, color, size, distinctive features)
            - Maintain the order characters appear in the story
            - Use the exact names from the story""";

    private static final String PROFILE_SYSTEM_MESSAGE = """
            You are a character profile specialist for children's book illustrations.
            Create detailed visual descriptions for consistent character illustration.
            Return your response as valid JSON in this exact format:
            {
                "species": "The exact species or type",
                "physical_description": "Detailed physical description with colors, sizes, and proportions",
                "clothing": "Description of what the character wears",
                "distinctive_features": "Unique visual features that make this character recognizable",
                "personality_traits": "Key personality traits that affect appearance"
            }

            The "species" field MUST be specific ("human", "dog", "rabbit", "dragon", "butterfly"),
            never a generic term like "character" or "creature".
            ALWAYS describe clothing (or "no clothing, natural fur/feathers" for animals).
            ALWAYS identify at least one distinctive visual feature.
            Keep descriptions child-appropriate.""";

    private final LlmProvider textProvider;
    private final ProjectStoreService projectStore;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public record ExtractedCharacter(String name, String description) {}

    public CharacterExtractionService(
            @Qualifier("textLlmProvider") LlmProvider textProvider,
            ProjectStoreService projectStore) {
        this.textProvider = textProvider;
        this.projectStore = projectStore;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CHARACTER_EXTRACTION;
    }

    @Override
    public Class<CharacterExtractionRequest> inputType() {
        return CharacterExtractionRequest.class;
    }

    @Override
    public void validate(CharacterExtractionRequest request) {
        if (request.pages() == null || request.pages().isEmpty()) {
            throw new TaskValidationException("pages are required to extract characters");
        }
        boolean anyText = request.pages().stream()
                .anyMatch(page -> page != null && page.text() != null && !page.text().isBlank());
        if (!anyText) {
            throw new TaskValidationException("pages contain no text");
        }
    }

    @Override
    public CharacterExtractionResult execute(CharacterExtractionRequest request) {
        List<CharacterProfile> profiles = extractProfiles(request.pages());
        if (request.storyId() != null && !request.storyId().isBlank()) {
            projectStore.saveCharacterProfiles(request.storyId(), profiles);
        }
        return new CharacterExtractionResult(request.storyId(), profiles);
    }

    public List<CharacterProfile> extractProfiles(List<StoryPage> pages) {
        String fullStory = pages.stream()
                .filter(page -> page != null && page.text() != null && !page.text().isBlank())
                .map(page -> "Page " + page.pageNumber() + ": " + page.text())
                .collect(Collectors.joining("\n\n"));

        List<ExtractedCharacter> characters = extractCharacters(fullStory);
        List<CharacterProfile> profiles = new ArrayList<>();
        for (ExtractedCharacter character : characters) {
            try {
                profiles.add(createProfile(character, fullStory));
            } catch (Exception e) {
                log.warn("Skipping profile for '{}': {}", character.name(), e.getMessage());
            }
        }
        log.info("Built {} character profile(s) from {} extracted character(s)", profiles.size(), characters.size());
        return profiles;
    }

    List<ExtractedCharacter> extractCharacters(String fullStory) {
        String prompt = String.format("""
                Extract all characters from this story:

                %s

                Return ONLY valid JSON with "characters" array containing objects with "name" and "description" fields. No other text.""",
                fullStory);

        String response = textProvider.generate(prompt,
                LlmOptions.withTemperature(EXTRACTION_TEMPERATURE).withSystemMessage(EXTRACTION_SYSTEM_MESSAGE));
        JsonNode root = parseJson(response, "character list");
        JsonNode charactersNode = root.get("characters");
        if (charactersNode == null || !charactersNode.isArray()) {
            throw new LlmProviderException("Character extraction response is missing the 'characters' array");
        }

        List<ExtractedCharacter> characters = new ArrayList<>();
        for (JsonNode node : charactersNode) {
            String name = firstText(node, "name", "character_name", "character");
            if (name == null) {
                continue;
            }
            String description = firstText(node, "description", "physical_description", "brief_description", "desc");
            characters.add(new ExtractedCharacter(name, description == null ? "No description provided" : description));
        }
        log.debug("Extracted characters: {}", characters);
        return characters;
    }

    CharacterProfile createProfile(ExtractedCharacter character, String storyContext) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Create a detailed character profile for illustration:\n\n");
        prompt.append("Character Name: ").append(character.name()).append("\n");
        prompt.append("Basic Description: ").append(character.description()).append("\n");
        if (storyContext != null && !storyContext.isBlank()) {
            prompt.append("\nStory Context: ").append(storyContext).append("\n");
        }
        prompt.append("\nReturn ONLY the JSON response with no additional text.");

        String response = textProvider.generate(prompt.toString(),
                LlmOptions.withTemperature(EXTRACTION_TEMPERATURE).withSystemMessage(PROFILE_SYSTEM_MESSAGE));
        JsonNode data = parseJson(response, "profile for " + character.name());

        String physicalDescription = firstText(data, "physical_description", "physicalDescription");
        return new CharacterProfile(
                character.name(),
                normalizeSpecies(firstText(data, "species"), character),
                physicalDescription != null ? physicalDescription : character.description(),
                firstText(data, "clothing"),
                firstText(data, "distinctive_features", "distinctiveFeatures"),
                firstText(data, "personality_traits", "personalityTraits")
        );
    }

    /**
     * Replace a missing or generic species with one found in the description or name, defaulting
     * to human. The result is capitalized.
     */
    static String normalizeSpecies(String species, ExtractedCharacter character) {
        String candidate = species == null ? "" : species.trim().toLowerCase(Locale.ROOT);
        if (GENERIC_SPECIES.contains(candidate)) {
            candidate = findSpecies(character.description());
            if (candidate == null) {
                candidate = findSpecies(character.name());
            }
            if (candidate == null) {
                candidate = "human";
            }
        }
        return Character.toUpperCase(candidate.charAt(0)) + candidate.substring(1);
    }

    private static String findSpecies(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : SPECIES_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private JsonNode parseJson(String response, String what) {
        if (response == null || response.isBlank()) {
            throw new LlmProviderException("Empty response while extracting " + what);
        }
        String json = stripCodeFence(response.trim());
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable JSON for {}: {}", what, json.length() > 500 ? json.substring(0, 500) : json);
            throw new LlmProviderException("Failed to parse JSON response for " + what, e);
        }
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String[] lines = text.split("\n");
        if (lines.length <= 2) {
            return text;
        }
        int end = lines[lines.length - 1].trim().startsWith("```") ? lines.length - 1 : lines.length;
        StringBuilder body = new StringBuilder();
        for (int i = 1; i < end; i++) {
            body.append(lines[i]).append("\n");
        }
        return body.toString().trim();
    }

    private String firstText(JsonNode node, String... fieldNames) {
        for (String field : fieldNames) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
