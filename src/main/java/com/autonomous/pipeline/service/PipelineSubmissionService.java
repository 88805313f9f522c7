package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineDefinition;
import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.RunSubmission;
import com.autonomous.pipeline.store.RunAlreadyExistsException;
import com.autonomous.pipeline.store.RunLockedException;
import com.autonomous.pipeline.store.RunNotFoundException;
import com.autonomous.pipeline.store.StateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs orchestrations in the background for the control API, one task per working directory.
 * Preconditions that the caller can fix (unknown pipeline, missing or existing run, run not
 * parked) are checked before submitting, so they surface synchronously.
 */
@Service
public class PipelineSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(PipelineSubmissionService.class);

    private final PipelineOrchestratorService orchestrator;
    private final PipelineDefinitionLoader definitions;
    private final StateStore stateStore;

    private final Map<Path, RunSubmission> activeRuns = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public PipelineSubmissionService(PipelineOrchestratorService orchestrator,
                                     PipelineDefinitionLoader definitions,
                                     StateStore stateStore,
                                     @Value("${pipeline.workers:4}") int workers) {
        this.orchestrator = orchestrator;
        this.definitions = definitions;
        this.stateStore = stateStore;
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers));
    }

    public RunSubmission submitStart(Path workDir, String pipeline, Collection<String> skipStages) {
        PipelineDefinition definition = definitions.requireDefinition(pipeline);
        Path location = locate(workDir);
        if (stateStore.exists(location)) {
            throw new RunAlreadyExistsException(location);
        }
        List<String> skips = skipStages != null ? List.copyOf(skipStages) : List.of();
        return submit(location, pipeline, "START", () -> orchestrator.start(location, definition, skips));
    }

    public RunSubmission submitResume(Path workDir, String pipeline) {
        PipelineDefinition definition = definitions.requireDefinition(pipeline);
        Path location = locate(workDir);
        if (!stateStore.exists(location)) {
            throw new RunNotFoundException(location);
        }
        return submit(location, pipeline, "RESUME", () -> orchestrator.resume(location, definition));
    }

    public RunSubmission submitApprove(Path workDir, String pipeline) {
        PipelineDefinition definition = definitions.requireDefinition(pipeline);
        Path location = locate(workDir);
        PipelineRun run = stateStore.load(location);
        if (run.getAwaitingApprovalAfter() == null) {
            throw new PipelineStateException("Run " + run.getRunId() + " is not waiting for approval");
        }
        return submit(location, pipeline, "APPROVE", () -> orchestrator.approve(location, definition));
    }

    public boolean abort(Path workDir, String reason) {
        return orchestrator.abort(locate(workDir), reason != null ? reason : "aborted by operator");
    }

    public PipelineOutcome reject(Path workDir, String reason) {
        Path location = locate(workDir);
        if (activeRuns.containsKey(location)) {
            throw new RunLockedException(location);
        }
        return orchestrator.reject(location, reason);
    }

    public PipelineRun skipStage(Path workDir, String stage) {
        Path location = locate(workDir);
        if (activeRuns.containsKey(location)) {
            throw new RunLockedException(location);
        }
        return orchestrator.skipStage(location, stage);
    }

    public PipelineRun status(Path workDir) {
        return orchestrator.status(locate(workDir));
    }

    public boolean hasActiveRun(Path workDir) {
        return activeRuns.containsKey(locate(workDir));
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.keySet().forEach(location -> orchestrator.abort(location, "orchestrator shutting down"));
        executor.shutdown();
    }

    private RunSubmission submit(Path location, String pipeline, String action, Supplier<PipelineOutcome> work) {
        RunSubmission submission = RunSubmission.builder()
            .submissionId(UUID.randomUUID().toString().substring(0, 8))
            .workDir(location)
            .pipeline(pipeline)
            .action(action)
            .submittedAt(Instant.now())
            .build();

        if (activeRuns.putIfAbsent(location, submission) != null) {
            throw new RunLockedException(location);
        }

        try {
            CompletableFuture<PipelineOutcome> future = CompletableFuture.supplyAsync(() -> {
                try {
                    PipelineOutcome outcome = work.get();
                    log.info("{} of pipeline '{}' in {} returned {}", action, pipeline, location, outcome.getStatus());
                    return outcome;
                } catch (RuntimeException e) {
                    log.error("{} of pipeline '{}' in {} failed: {}", action, pipeline, location, e.getMessage(), e);
                    throw e;
                } finally {
                    activeRuns.remove(location, submission);
                }
            }, executor);
            submission.setFuture(future);
        } catch (RuntimeException e) {
            activeRuns.remove(location, submission);
            throw e;
        }

        log.info("Submitted {} of pipeline '{}' for {} ({})", action, pipeline, location, submission.getSubmissionId());
        return submission;
    }

    private static Path locate(Path workDir) {
        return workDir.toAbsolutePath().normalize();
    }
}
