package org.example.storybook.service.task;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs generation work on a fixed pool of background workers and exposes poll-able task status.
 * <p>
 * {@link #submit} validates the input, registers the task as PENDING and returns before the work
 * starts. Any exception thrown by the work is caught on the worker and stored on the task.
 * Running tasks are never cancelled; an optional running timeout only marks them as failed.
 */
@Service
public class GenerationTaskService {

    private static final Logger log = LoggerFactory.getLogger(GenerationTaskService.class);

    static final String MDC_TASK_ID = "taskId";

    private final Map<TaskKind, GenerationTaskHandler<?, ?>> handlers = new EnumMap<>(TaskKind.class);
    private final TaskStore taskStore;
    private final ObjectMapper objectMapper;
    private final ThreadPoolExecutor executor;
    private final long retentionMinutes;
    private final long runningTimeoutMinutes;

    public GenerationTaskService(
            List<GenerationTaskHandler<?, ?>> taskHandlers,
            TaskStore taskStore,
            ObjectMapper objectMapper,
            @Value("${generation.tasks.max-concurrent:2}") int maxConcurrentTasks,
            @Value("${generation.tasks.retention-minutes:0}") long retentionMinutes,
            @Value("${generation.tasks.running-timeout-minutes:0}") long runningTimeoutMinutes) {
        for (GenerationTaskHandler<?, ?> handler : taskHandlers) {
            GenerationTaskHandler<?, ?> previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate task handler for " + handler.kind());
            }
        }
        this.taskStore = taskStore;
        // unknown top-level keys are input errors, not silently dropped settings
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.retentionMinutes = retentionMinutes;
        this.runningTimeoutMinutes = runningTimeoutMinutes;
        int poolSize = Math.max(1, maxConcurrentTasks);
        this.executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new GenerationWorkerThreadFactory());
        log.info("Generation task service started: workers={}, handlers={}", poolSize, handlers.keySet());
    }

    /**
     * Validate the input and queue the task.
     *
     * @param input the handler's input type, or anything convertible to it (a JSON tree or map)
     * @return status snapshot taken before any work starts, so always PENDING
     * @throws TaskValidationException if the kind is unsupported or the input is malformed
     */
    public TaskStatus submit(TaskKind kind, Object input) {
        if (kind == null) {
            throw new TaskValidationException("Task kind is required");
        }
        GenerationTaskHandler<?, ?> handler = handlers.get(kind);
        if (handler == null) {
            throw new TaskValidationException("No handler registered for task kind " + kind.pathName());
        }
        return submitTo(handler, input);
    }

    public TaskStatus status(String taskId) {
        return findStatus(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public Optional<TaskStatus> findStatus(String taskId) {
        return taskStore.get(taskId).map(GenerationTask::toStatus);
    }

    /**
     * Block until the task is terminal or the timeout passes, then return its status.
     * For in-process callers; the external contract is polling.
     */
    public TaskStatus awaitCompletion(String taskId, Duration timeout) {
        GenerationTask task = taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        try {
            return task.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return task.toStatus();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return task.toStatus();
        } catch (ExecutionException e) {
            // completion is never completed exceptionally
            throw new IllegalStateException("Unexpected completion failure for task " + taskId, e);
        }
    }

    public int getWorkerCount() {
        return executor.getMaximumPoolSize();
    }

    public int getActiveWorkerCount() {
        return executor.getActiveCount();
    }

    public int getQueuedTaskCount() {
        return executor.getQueue().size();
    }

    public int getTrackedTaskCount() {
        return taskStore.size();
    }

    /**
     * Evict old terminal tasks and fail tasks that have been running too long, when those
     * policies are enabled.
     */
    @Scheduled(fixedDelayString = "${generation.tasks.sweep-interval-ms:60000}")
    public void sweep() {
        if (retentionMinutes <= 0 && runningTimeoutMinutes <= 0) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        int evicted = 0;
        int timedOut = 0;
        for (GenerationTask task : taskStore.all()) {
            TaskState state = task.state();
            if (retentionMinutes > 0 && state.isTerminal()
                    && task.completedAt() != null
                    && task.completedAt().plusMinutes(retentionMinutes).isBefore(now)) {
                if (taskStore.remove(task.taskId())) {
                    evicted++;
                }
            } else if (runningTimeoutMinutes > 0 && state == TaskState.RUNNING
                    && task.startedAt() != null
                    && task.startedAt().plusMinutes(runningTimeoutMinutes).isBefore(now)) {
                if (task.markFailed("Task exceeded running timeout of " + runningTimeoutMinutes + " minute(s)")) {
                    timedOut++;
                }
            }
        }
        if (evicted > 0 || timedOut > 0) {
            log.info("Task sweep: evicted={}, timedOut={}, remaining={}", evicted, timedOut, taskStore.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private <I, R> TaskStatus submitTo(GenerationTaskHandler<I, R> handler, Object rawInput) {
        I input = convertInput(handler, rawInput);
        handler.validate(input);

        GenerationTask task = new GenerationTask(UUID.randomUUID().toString(), handler.kind(), input);
        taskStore.put(task);
        TaskStatus queued = task.toStatus();

        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        executor.execute(() -> runTask(task, handler, input, callerContext));
        log.info("Queued {} task {}", handler.kind().pathName(), task.taskId());
        return queued;
    }

    private <I> I convertInput(GenerationTaskHandler<I, ?> handler, Object rawInput) {
        if (rawInput == null) {
            throw new TaskValidationException("Task input is required");
        }
        Class<I> inputType = handler.inputType();
        if (inputType.isInstance(rawInput)) {
            return inputType.cast(rawInput);
        }
        try {
            return objectMapper.convertValue(rawInput, inputType);
        } catch (IllegalArgumentException e) {
            throw new TaskValidationException("Malformed input for " + handler.kind().pathName()
                    + " task: " + rootMessage(e), e);
        }
    }

    private <I, R> void runTask(
            GenerationTask task,
            GenerationTaskHandler<I, R> handler,
            I input,
            Map<String, String> callerContext) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put(MDC_TASK_ID, task.taskId());
        try {
            if (!task.markRunning()) {
                return;
            }
            log.info("Running {} task", handler.kind().pathName());
            R result = handler.execute(input);
            if (task.markCompleted(result)) {
                log.info("Completed {} task", handler.kind().pathName());
            }
        } catch (Exception ex) {
            log.warn("{} task {} failed: {}", handler.kind().pathName(), task.taskId(), safeErrorMessage(ex), ex);
            task.markFailed(safeErrorMessage(ex));
        } catch (Throwable error) {
            // a worker must never leave its task RUNNING; the pool replaces the thread
            log.error("{} task {} aborted by {}", handler.kind().pathName(), task.taskId(),
                    error.getClass().getName(), error);
            task.markFailed(safeErrorMessage(error));
            throw error;
        } finally {
            MDC.clear();
        }
    }

    private String safeErrorMessage(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message.split("\n")[0];
    }

    private static final class GenerationWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "generation-worker-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
