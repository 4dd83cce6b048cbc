package org.example.storybook.service.task;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TaskKind {
    STORY_GENERATION,
    CHARACTER_EXTRACTION,
    PAGE_ILLUSTRATION,
    ART_BIBLE_IMAGE,
    CHARACTER_REFERENCE_IMAGE;

    /**
     * Kebab-case name used in URLs, e.g. {@code story-generation}.
     */
    public String pathName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static Optional<TaskKind> fromPathName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(normalized))
                .findFirst();
    }
}
