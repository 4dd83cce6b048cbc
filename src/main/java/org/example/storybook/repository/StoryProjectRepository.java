package org.example.storybook.repository;

import org.example.storybook.entity.StoryProjectEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StoryProjectRepository extends JpaRepository<StoryProjectEntity, String> {
}
