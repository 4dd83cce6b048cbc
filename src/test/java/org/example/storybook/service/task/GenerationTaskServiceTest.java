package org.example.storybook.service.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryGenerationRequest;
import org.example.storybook.service.ProjectStoreService;
import org.example.storybook.service.StoryGenerationService;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationTaskServiceTest {

    private static final String THREE_PAGE_STORY = """
            Page 1: Pip the mouse lived under a big oak tree.
            Page 2: One day Pip found a shiny red berry.
            Page 3: Pip shared the berry with Ollie the owl.""";

    @Mock
    private LlmProvider textProvider;

    @Mock
    private ProjectStoreService projectStore;

    private BlockingHandler blockingHandler;
    private GenerationTaskService service;

    @BeforeEach
    void setUp() {
        blockingHandler = new BlockingHandler();
        service = newService(2);
    }

    @AfterEach
    void tearDown() {
        blockingHandler.release.countDown();
        service.shutdown();
    }

    @Test
    void submit_returnsPendingSnapshotAndEventuallyCompletes() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn(THREE_PAGE_STORY);

        TaskStatus submitted = service.submit(TaskKind.STORY_GENERATION,
                StoryGenerationRequest.titled("The Brave Little Mouse", 3));

        assertNotNull(submitted.taskId());
        assertEquals(TaskState.PENDING, submitted.state());
        assertEquals(TaskKind.STORY_GENERATION, submitted.kind());
        assertNull(submitted.result());

        TaskStatus finished = waitForTerminalState(submitted.taskId());
        assertEquals(TaskState.COMPLETED, finished.state());
        assertNull(finished.error());
        assertNotNull(finished.startedAt());
        assertNotNull(finished.completedAt());

        Story story = (Story) finished.result();
        assertEquals(3, story.pages().size());
        assertEquals("The Brave Little Mouse", story.metadata().title());
        verify(projectStore).saveStory(story);
    }

    @Test
    void submit_acceptsJsonShapedInput() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn(THREE_PAGE_STORY);

        TaskStatus submitted = service.submit(TaskKind.STORY_GENERATION,
                Map.of("title", "The Brave Little Mouse", "numPages", 3, "genre", "adventure"));

        TaskStatus finished = waitForTerminalState(submitted.taskId());
        assertEquals(TaskState.COMPLETED, finished.state());
        verify(textProvider).generate(contains("Genre: adventure."), any(LlmOptions.class));
    }

    @Test
    void submit_acceptsSnakeCaseKeys() {
        when(textProvider.generate(anyString(), any(LlmOptions.class))).thenReturn(THREE_PAGE_STORY);

        TaskStatus submitted = service.submit(TaskKind.STORY_GENERATION,
                Map.of("title", "The Brave Little Mouse", "num_pages", 3, "words_per_page", 40));

        TaskStatus finished = waitForTerminalState(submitted.taskId());
        assertEquals(TaskState.COMPLETED, finished.state());
        assertEquals(3, ((Story) finished.result()).metadata().numPages());
        verify(textProvider).generate(contains("exactly 3 pages, with each page containing about 40 words"),
                any(LlmOptions.class));
    }

    @Test
    void submit_unknownKeyIsRejected() {
        TaskValidationException error = assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.STORY_GENERATION,
                        Map.of("title", "The Brave Little Mouse", "pageCount", 3)));

        assertTrue(error.getMessage().contains("pageCount"), error.getMessage());
        assertEquals(0, service.getTrackedTaskCount());
        verify(textProvider, never()).generate(anyString(), any(LlmOptions.class));
    }

    @Test
    void handlerError_endsInErrorInsteadOfStayingRunning() {
        service.shutdown();
        service = new GenerationTaskService(
                List.of(new OverflowingHandler()), new TaskStore(), new ObjectMapper(), 1, 0, 0);

        TaskStatus submitted = service.submit(TaskKind.CHARACTER_EXTRACTION, "deep");
        TaskStatus finished = service.awaitCompletion(submitted.taskId(), Duration.ofSeconds(5));

        assertEquals(TaskState.ERROR, finished.state());
        assertEquals("StackOverflowError", finished.error());

        // the replacement worker still picks up work
        TaskStatus next = service.awaitCompletion(
                service.submit(TaskKind.CHARACTER_EXTRACTION, "again").taskId(), Duration.ofSeconds(5));
        assertEquals(TaskState.ERROR, next.state());
    }

    @Test
    void providerFailure_endsInErrorAndLaterTasksStillRun() {
        when(textProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new LlmProviderException("Ollama request timed out"))
                .thenReturn(THREE_PAGE_STORY);

        TaskStatus failed = waitForTerminalState(
                service.submit(TaskKind.STORY_GENERATION, StoryGenerationRequest.titled("Storm", 3)).taskId());
        assertEquals(TaskState.ERROR, failed.state());
        assertEquals("Ollama request timed out", failed.error());
        assertNull(failed.result());

        TaskStatus next = waitForTerminalState(
                service.submit(TaskKind.STORY_GENERATION, StoryGenerationRequest.titled("Sunshine", 3)).taskId());
        assertEquals(TaskState.COMPLETED, next.state());
    }

    @Test
    void submit_invalidInputCreatesNoTask() {
        assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.STORY_GENERATION, StoryGenerationRequest.titled(" ", 3)));
        assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.STORY_GENERATION, StoryGenerationRequest.titled("Too long", 31)));
        assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.STORY_GENERATION, Map.of("title", "Bad", "numPages", "many")));
        assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.STORY_GENERATION, null));

        assertEquals(0, service.getTrackedTaskCount());
        verify(textProvider, never()).generate(anyString(), any(LlmOptions.class));
    }

    @Test
    void submit_kindWithoutHandlerIsRejected() {
        assertThrows(TaskValidationException.class,
                () -> service.submit(TaskKind.PAGE_ILLUSTRATION, Map.of("storyId", "s1")));
    }

    @Test
    void status_unknownTaskThrows() {
        assertThrows(TaskNotFoundException.class, () -> service.status("missing"));
        assertTrue(service.findStatus("missing").isEmpty());
        assertTrue(service.findStatus(null).isEmpty());
    }

    @Test
    void tasksBeyondWorkerCountWaitAsPending() throws InterruptedException {
        service.shutdown();
        service = newService(1);

        TaskStatus first = service.submit(TaskKind.ART_BIBLE_IMAGE, "first");
        assertTrue(blockingHandler.started.await(5, TimeUnit.SECONDS));
        TaskStatus second = service.submit(TaskKind.ART_BIBLE_IMAGE, "second");

        assertEquals(TaskState.RUNNING, service.status(first.taskId()).state());
        assertEquals(TaskState.PENDING, service.status(second.taskId()).state());
        assertEquals(1, service.getWorkerCount());
        assertEquals(1, service.getQueuedTaskCount());

        blockingHandler.release.countDown();

        assertEquals("done:first", waitForTerminalState(first.taskId()).result());
        assertEquals("done:second", waitForTerminalState(second.taskId()).result());
        assertEquals(2, service.getTrackedTaskCount());
    }

    @Test
    void awaitCompletion_returnsCurrentStatusOnTimeout() {
        TaskStatus submitted = service.submit(TaskKind.ART_BIBLE_IMAGE, "slow");

        TaskStatus waited = service.awaitCompletion(submitted.taskId(), Duration.ofMillis(50));
        assertFalse(waited.isTerminal());

        blockingHandler.release.countDown();
        TaskStatus finished = service.awaitCompletion(submitted.taskId(), Duration.ofSeconds(5));
        assertEquals(TaskState.COMPLETED, finished.state());
        assertEquals("done:slow", finished.result());
    }

    @Test
    void sweep_withPoliciesDisabledKeepsTasks() {
        blockingHandler.release.countDown();
        TaskStatus submitted = service.submit(TaskKind.ART_BIBLE_IMAGE, "kept");
        waitForTerminalState(submitted.taskId());

        service.sweep();

        assertEquals(TaskState.COMPLETED, service.status(submitted.taskId()).state());
    }

    @Test
    void constructor_rejectsDuplicateHandlers() {
        BlockingHandler another = new BlockingHandler();
        assertThrows(IllegalStateException.class, () -> new GenerationTaskService(
                List.of(blockingHandler, another), new TaskStore(), new ObjectMapper(), 1, 0, 0));
    }

    private GenerationTaskService newService(int workers) {
        StoryGenerationService storyGeneration = new StoryGenerationService(textProvider, projectStore);
        return new GenerationTaskService(
                List.of(storyGeneration, blockingHandler),
                new TaskStore(),
                new ObjectMapper().findAndRegisterModules(),
                workers,
                0,
                0);
    }

    private TaskStatus waitForTerminalState(String taskId) {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            TaskStatus status = service.status(taskId);
            if (status.isTerminal()) {
                return status;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for task completion");
            }
        }
        fail("Timed out waiting for task to complete");
        return null;
    }

    private static final class BlockingHandler implements GenerationTaskHandler<String, String> {
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public TaskKind kind() {
            return TaskKind.ART_BIBLE_IMAGE;
        }

        @Override
        public Class<String> inputType() {
            return String.class;
        }

        @Override
        public void validate(String input) {
            if (input.isBlank()) {
                throw new TaskValidationException("input is required");
            }
        }

        @Override
        public String execute(String input) {
            started.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return "done:" + input;
        }
    }

    private static final class OverflowingHandler implements GenerationTaskHandler<String, String> {
        @Override
        public TaskKind kind() {
            return TaskKind.CHARACTER_EXTRACTION;
        }

        @Override
        public Class<String> inputType() {
            return String.class;
        }

        @Override
        public void validate(String input) {
        }

        @Override
        public String execute(String input) {
            throw new StackOverflowError();
        }
    }
}
