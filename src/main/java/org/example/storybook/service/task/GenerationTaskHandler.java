package org.example.storybook.service.task;

/**
 * One kind of background generation work.
 *
 * @param <I> task input
 * @param <R> task result
 */
public interface GenerationTaskHandler<I, R> {

    TaskKind kind();

    Class<I> inputType();

    /**
     * Reject malformed input before a task is created.
     *
     * @throws TaskValidationException if the input cannot be run
     */
    void validate(I input);

    /**
     * Run the work on a worker thread. Any exception becomes the task's error.
     */
    R execute(I input);
}
