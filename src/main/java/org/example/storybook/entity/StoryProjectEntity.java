package org.example.storybook.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.LocalDateTime;

/**
 * Durable project for one story: the story itself plus the inputs a visual session is rebuilt from.
 * Nested structures are stored as JSON text.
 */
@Entity
@Table(name = "story_projects")
public class StoryProjectEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(length = 300)
    private String title;

    @Column(length = 100)
    private String artStyle;

    @Column(name = "story_json", columnDefinition = "TEXT")
    private String storyJson;

    @Column(name = "art_bible_json", columnDefinition = "TEXT")
    private String artBibleJson;

    @Column(name = "characters_json", columnDefinition = "TEXT")
    private String charactersJson;

    @Column(name = "character_references_json", columnDefinition = "TEXT")
    private String characterReferencesJson;

    // default fills the column on projects created before it existed
    @Version
    @Column(name = "version", columnDefinition = "BIGINT DEFAULT 0 NOT NULL")
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public StoryProjectEntity() {
    }

    public StoryProjectEntity(String id) {
        this.id = id;
    }

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getArtStyle() {
        return artStyle;
    }

    public void setArtStyle(String artStyle) {
        this.artStyle = artStyle;
    }

    public String getStoryJson() {
        return storyJson;
    }

    public void setStoryJson(String storyJson) {
        this.storyJson = storyJson;
    }

    public String getArtBibleJson() {
        return artBibleJson;
    }

    public void setArtBibleJson(String artBibleJson) {
        this.artBibleJson = artBibleJson;
    }

    public String getCharactersJson() {
        return charactersJson;
    }

    public void setCharactersJson(String charactersJson) {
        this.charactersJson = charactersJson;
    }

    public String getCharacterReferencesJson() {
        return characterReferencesJson;
    }

    public void setCharacterReferencesJson(String characterReferencesJson) {
        this.characterReferencesJson = characterReferencesJson;
    }

    public Long getVersion() {
        return version;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
