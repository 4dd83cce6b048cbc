package org.example.storybook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.entity.StoryProjectEntity;
import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryPage;
import org.example.storybook.repository.StoryProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable per-story project data: the story and the inputs a visual session is rebuilt from
 * (art bible, character profiles, character references). Session ids are never stored.
 * <p>
 * Every write is a read-modify-write of one row. Writers of the same story are serialized and each
 * commits before the next one reads; the entity version rejects writers from other processes, which
 * are retried against the fresh row.
 */
@Service
public class ProjectStoreService {

    private static final Logger log = LoggerFactory.getLogger(ProjectStoreService.class);

    private static final TypeReference<List<CharacterProfile>> PROFILE_LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, CharacterReference>> REFERENCE_MAP = new TypeReference<>() {};

    private static final int LOCK_STRIPES = 64;

    private final StoryProjectRepository repository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock[] storyLocks = new ReentrantLock[LOCK_STRIPES];
    private final int maxWriteAttempts;

    public ProjectStoreService(
            StoryProjectRepository repository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            @Value("${project-store.max-write-attempts:4}") int maxWriteAttempts) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxWriteAttempts = Math.max(1, maxWriteAttempts);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            storyLocks[i] = new ReentrantLock();
        }
    }

    public boolean exists(String storyId) {
        return storyId != null && repository.existsById(storyId);
    }

    public void saveStory(Story story) {
        String title = writeProject(story.id(), () -> {
            StoryProjectEntity entity = loadOrCreate(story.id());
            if (story.metadata() != null) {
                entity.setTitle(story.metadata().title());
                entity.setArtStyle(story.metadata().artStyle());
            }
            entity.setStoryJson(write(story));
            if (story.characters() != null && !story.characters().isEmpty()) {
                entity.setCharactersJson(write(story.characters()));
            }
            return repository.saveAndFlush(entity).getTitle();
        });
        log.info("Saved project for story {} ('{}')", story.id(), title);
    }

    @Transactional(readOnly = true)
    public Optional<Story> findStory(String storyId) {
        return repository.findById(storyId)
                .map(StoryProjectEntity::getStoryJson)
                .filter(json -> json != null && !json.isBlank())
                .map(json -> read(json, Story.class));
    }

    /**
     * Record a generated illustration on the stored story page, if both exist.
     */
    public boolean updatePageImage(String storyId, int pageNumber, String imageUrl, String imagePrompt) {
        if (storyId == null || storyId.isBlank()) {
            return false;
        }
        return writeProject(storyId, () -> applyPageImage(storyId, pageNumber, imageUrl, imagePrompt));
    }

    private boolean applyPageImage(String storyId, int pageNumber, String imageUrl, String imagePrompt) {
        Optional<StoryProjectEntity> entity = repository.findById(storyId);
        if (entity.isEmpty() || entity.get().getStoryJson() == null) {
            return false;
        }
        Story story = read(entity.get().getStoryJson(), Story.class);
        boolean found = false;
        List<StoryPage> pages = new ArrayList<>();
        for (StoryPage page : story.pages()) {
            if (page.pageNumber() == pageNumber) {
                pages.add(page.withImage(imageUrl, imagePrompt));
                found = true;
            } else {
                pages.add(page);
            }
        }
        if (!found) {
            return false;
        }
        Story updated = new Story(story.id(), story.metadata(), pages, story.characters(),
                story.createdAt(), LocalDateTime.now());
        entity.get().setStoryJson(write(updated));
        repository.saveAndFlush(entity.get());
        return true;
    }

    public void saveCharacterProfiles(String storyId, List<CharacterProfile> profiles) {
        writeProject(storyId, () -> {
            StoryProjectEntity entity = loadOrCreate(storyId);
            entity.setCharactersJson(write(profiles == null ? List.of() : profiles));
            return repository.saveAndFlush(entity);
        });
        log.info("Saved {} character profile(s) for story {}", profiles == null ? 0 : profiles.size(), storyId);
    }

    @Transactional(readOnly = true)
    public List<CharacterProfile> findCharacterProfiles(String storyId) {
        return repository.findById(storyId)
                .map(StoryProjectEntity::getCharactersJson)
                .filter(json -> json != null && !json.isBlank())
                .map(json -> readType(json, PROFILE_LIST))
                .orElse(List.of());
    }

    public void saveArtBible(String storyId, ArtBible artBible) {
        writeProject(storyId, () -> {
            StoryProjectEntity entity = loadOrCreate(storyId);
            entity.setArtBibleJson(write(artBible));
            if (artBible.artStyle() != null && !artBible.artStyle().isBlank()) {
                entity.setArtStyle(artBible.artStyle());
            }
            return repository.saveAndFlush(entity);
        });
    }

    @Transactional(readOnly = true)
    public Optional<ArtBible> findArtBible(String storyId) {
        return repository.findById(storyId)
                .map(StoryProjectEntity::getArtBibleJson)
                .filter(json -> json != null && !json.isBlank())
                .map(json -> read(json, ArtBible.class));
    }

    public void saveCharacterReference(String storyId, CharacterReference reference) {
        writeProject(storyId, () -> {
            StoryProjectEntity entity = loadOrCreate(storyId);
            LinkedHashMap<String, CharacterReference> references = readReferences(entity);
            references.put(reference.characterName(), reference);
            entity.setCharacterReferencesJson(write(references));
            return repository.saveAndFlush(entity);
        });
    }

    @Transactional(readOnly = true)
    public Map<String, CharacterReference> findCharacterReferences(String storyId) {
        return repository.findById(storyId)
                .<Map<String, CharacterReference>>map(this::readReferences)
                .orElse(Map.of());
    }

    @Transactional(readOnly = true)
    public Optional<String> findArtStyle(String storyId) {
        return repository.findById(storyId)
                .map(StoryProjectEntity::getArtStyle)
                .filter(style -> !style.isBlank());
    }

    private <T> T writeProject(String storyId, Supplier<T> work) {
        if (storyId == null || storyId.isBlank()) {
            throw new IllegalArgumentException("storyId is required");
        }
        ReentrantLock lock = storyLocks[Math.floorMod(storyId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return transactionTemplate.execute(status -> work.get());
                } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
                    if (attempt >= maxWriteAttempts) {
                        throw e;
                    }
                    log.warn("Project {} changed underneath a write (attempt {}/{}), retrying",
                            storyId, attempt, maxWriteAttempts);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private StoryProjectEntity loadOrCreate(String storyId) {
        if (storyId == null || storyId.isBlank()) {
            throw new IllegalArgumentException("storyId is required");
        }
        return repository.findById(storyId).orElseGet(() -> new StoryProjectEntity(storyId));
    }

    private LinkedHashMap<String, CharacterReference> readReferences(StoryProjectEntity entity) {
        String json = entity.getCharacterReferencesJson();
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return readType(json, REFERENCE_MAP);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize project data", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored " + type.getSimpleName(), e);
        }
    }

    private <T> T readType(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored project data", e);
        }
    }
}
