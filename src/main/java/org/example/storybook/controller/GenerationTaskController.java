package org.example.storybook.controller;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.service.task.GenerationTaskService;
import org.example.storybook.service.task.TaskKind;
import org.example.storybook.service.task.TaskStatus;
import org.example.storybook.service.task.TaskValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Submit background generation tasks and poll their status.
 */
@RestController
@RequestMapping("/api/tasks")
public class GenerationTaskController {

    private final GenerationTaskService generationTaskService;

    public GenerationTaskController(GenerationTaskService generationTaskService) {
        this.generationTaskService = generationTaskService;
    }

    /**
     * Queue a task of the given kind, e.g. {@code POST /api/tasks/story-generation}.
     *
     * @return 202 with the queued task, or 400 if the kind or input is invalid (no task is created)
     */
    @PostMapping("/{kind}")
    public ResponseEntity<?> submit(
            @PathVariable String kind,
            @RequestBody(required = false) JsonNode input,
            HttpServletRequest request) {
        Optional<TaskKind> taskKind = TaskKind.fromPathName(kind);
        if (taskKind.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(new ApiError("Unknown task kind: " + kind, RequestCorrelation.resolveRequestId(request)));
        }
        try {
            TaskStatus status = generationTaskService.submit(taskKind.get(), input);
            return ResponseEntity.accepted().body(status);
        } catch (TaskValidationException e) {
            return ResponseEntity.badRequest()
                    .body(new ApiError(e.getMessage(), RequestCorrelation.resolveRequestId(request)));
        }
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskStatus> getStatus(@PathVariable String taskId) {
        return generationTaskService.findStatus(taskId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
