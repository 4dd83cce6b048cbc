package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoryPage(
    @JsonAlias("page_number") int pageNumber,
    String text,
    @JsonAlias("image_url") String imageUrl,
    @JsonAlias("image_prompt") String imagePrompt
) {
    public static StoryPage of(int pageNumber, String text) {
        return new StoryPage(pageNumber, text, null, null);
    }

    public StoryPage withImage(String newImageUrl, String newImagePrompt) {
        return new StoryPage(pageNumber, text, newImageUrl, newImagePrompt);
    }
}
