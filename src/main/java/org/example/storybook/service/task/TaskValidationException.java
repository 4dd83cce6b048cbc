package org.example.storybook.service.task;

/**
 * Task input rejected at submission time. No task is created.
 */
public class TaskValidationException extends RuntimeException {

    public TaskValidationException(String message) {
        super(message);
    }

    public TaskValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
