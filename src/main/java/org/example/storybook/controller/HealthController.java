package org.example.storybook.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.service.image.ImageProvider;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.session.VisualSessionStore;
import org.example.storybook.service.task.GenerationTaskService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final LlmProvider textProvider;
    private final ImageProvider imageProvider;
    private final GenerationTaskService generationTaskService;
    private final VisualSessionStore sessionStore;

    public HealthController(
            @Qualifier("textLlmProvider") LlmProvider textProvider,
            ImageProvider imageProvider,
            GenerationTaskService generationTaskService,
            VisualSessionStore sessionStore) {
        this.textProvider = textProvider;
        this.imageProvider = imageProvider;
        this.generationTaskService = generationTaskService;
        this.sessionStore = sessionStore;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        ProviderHealth providers = new ProviderHealth(
                textProvider.getProviderName(),
                textProvider.isAvailable(),
                imageProvider.getProviderName(),
                imageProvider.isAvailable()
        );
        WorkerHealth workers = new WorkerHealth(
                generationTaskService.getWorkerCount(),
                generationTaskService.getActiveWorkerCount(),
                generationTaskService.getQueuedTaskCount(),
                generationTaskService.getTrackedTaskCount(),
                sessionStore.size()
        );
        boolean providersAvailable = providers.textAvailable() && providers.imageAvailable();

        return new HealthDetails(
                providersAvailable ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                providers,
                workers
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            ProviderHealth providers,
            WorkerHealth workers
    ) {
    }

    public record ProviderHealth(
            String textProvider,
            boolean textAvailable,
            String imageProvider,
            boolean imageAvailable
    ) {
    }

    public record WorkerHealth(
            int workerCount,
            int activeWorkers,
            int queuedTasks,
            int trackedTasks,
            int visualSessions
    ) {
    }
}
