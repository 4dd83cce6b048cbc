package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Style reference for a whole book: the prompt used to render the reference image plus the
 * style notes extracted from it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtBible(
    String prompt,
    @JsonAlias("art_style") String artStyle,
    @JsonAlias("image_url") String imageUrl,
    @JsonAlias("local_image_path") String localImagePath,
    @JsonAlias("style_notes") String styleNotes,
    @JsonAlias("color_palette") String colorPalette,
    @JsonAlias("lighting_style") String lightingStyle,
    @JsonAlias("brush_technique") String brushTechnique
) {
    public static ArtBible ofPrompt(String prompt, String artStyle) {
        return new ArtBible(prompt, artStyle, null, null, null, null, null, null);
    }

    public ArtBible withImage(String newImageUrl) {
        return new ArtBible(prompt, artStyle, newImageUrl, localImagePath, styleNotes,
                colorPalette, lightingStyle, brushTechnique);
    }
}
