package org.example.storybook.service.task;

public enum TaskState {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
