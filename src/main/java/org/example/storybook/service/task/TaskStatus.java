package org.example.storybook.service.task;

import java.time.LocalDateTime;

/**
 * Point-in-time view of a task. {@code result} is set only when completed, {@code error} only on error.
 */
public record TaskStatus(
        String taskId,
        TaskKind kind,
        TaskState state,
        Object input,
        Object result,
        String error,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        String message
) {
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
}
