package org.example.storybook.service.task;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable task record owned by the orchestrator. State only moves forward:
 * PENDING, RUNNING, then COMPLETED or ERROR.
 */
final class GenerationTask {

    private final String taskId;
    private final TaskKind kind;
    private final Object input;
    private final LocalDateTime createdAt;
    private final CompletableFuture<TaskStatus> completion = new CompletableFuture<>();

    private TaskState state = TaskState.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String message = "Task queued";
    private String error;
    private Object result;

    GenerationTask(String taskId, TaskKind kind, Object input) {
        this.taskId = taskId;
        this.kind = kind;
        this.input = input;
        this.createdAt = LocalDateTime.now();
    }

    String taskId() {
        return taskId;
    }

    TaskKind kind() {
        return kind;
    }

    CompletableFuture<TaskStatus> completion() {
        return completion;
    }

    synchronized TaskState state() {
        return state;
    }

    synchronized LocalDateTime createdAt() {
        return createdAt;
    }

    synchronized LocalDateTime startedAt() {
        return startedAt;
    }

    synchronized LocalDateTime completedAt() {
        return completedAt;
    }

    synchronized boolean markRunning() {
        if (state != TaskState.PENDING) {
            return false;
        }
        state = TaskState.RUNNING;
        startedAt = LocalDateTime.now();
        message = "Task running";
        return true;
    }

    boolean markCompleted(Object value) {
        TaskStatus snapshot;
        synchronized (this) {
            if (state.isTerminal()) {
                return false;
            }
            state = TaskState.COMPLETED;
            result = value;
            completedAt = LocalDateTime.now();
            message = "Task completed";
            snapshot = toStatus();
        }
        completion.complete(snapshot);
        return true;
    }

    boolean markFailed(String errorMessage) {
        TaskStatus snapshot;
        synchronized (this) {
            if (state.isTerminal()) {
                return false;
            }
            state = TaskState.ERROR;
            error = errorMessage == null || errorMessage.isBlank() ? "Task failed" : errorMessage;
            completedAt = LocalDateTime.now();
            message = "Task failed";
            snapshot = toStatus();
        }
        completion.complete(snapshot);
        return true;
    }

    synchronized TaskStatus toStatus() {
        return new TaskStatus(
                taskId,
                kind,
                state,
                input,
                result,
                error,
                createdAt,
                startedAt,
                completedAt,
                message
        );
    }
}
