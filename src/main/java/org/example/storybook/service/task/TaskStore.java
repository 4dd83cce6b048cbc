package org.example.storybook.service.task;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory task registry. Tasks live for the life of the process unless evicted.
 */
@Component
public class TaskStore {

    private final ConcurrentHashMap<String, GenerationTask> tasks = new ConcurrentHashMap<>();

    void put(GenerationTask task) {
        tasks.put(task.taskId(), task);
    }

    Optional<GenerationTask> get(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    Collection<GenerationTask> all() {
        return tasks.values();
    }

    boolean remove(String taskId) {
        return tasks.remove(taskId) != null;
    }

    public int size() {
        return tasks.size();
    }
}
