package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineDefinition;
import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.PipelineStatus;
import com.autonomous.pipeline.model.StageCancellation;
import com.autonomous.pipeline.model.StageDefinition;
import com.autonomous.pipeline.model.StageErrorKind;
import com.autonomous.pipeline.model.StageRecord;
import com.autonomous.pipeline.model.StageRequest;
import com.autonomous.pipeline.model.StageResult;
import com.autonomous.pipeline.model.StageStatus;
import com.autonomous.pipeline.store.RunLock;
import com.autonomous.pipeline.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Sequences the stages of a run, strictly one at a time, against the durable state store.
 *
 * Every state change is saved before it is reported to listeners or returned to the caller, so
 * whatever a caller has observed survives a crash. Resuming never re-executes a stage that is
 * completed or skipped; a stage found running was abandoned by a dead orchestrator and starts over.
 *
 * Callers are expected to run one orchestrator per working directory; the state store's advisory
 * lock turns a second concurrent call into a {@link com.autonomous.pipeline.store.RunLockedException}.
 */
@Service
public class PipelineOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);

    private final StateStore stateStore;
    private final StageExecutorService stageExecutor;
    private final ResultsSummaryWriter resultsWriter;
    private final List<PipelineEventListener> listeners;

    // Cancellation flag of the stage currently executing, per run location
    private final Map<Path, StageCancellation> activeStages = new ConcurrentHashMap<>();

    public PipelineOrchestratorService(StateStore stateStore,
                                       StageExecutorService stageExecutor,
                                       ResultsSummaryWriter resultsWriter,
                                       List<PipelineEventListener> listeners) {
        this.stateStore = stateStore;
        this.stageExecutor = stageExecutor;
        this.resultsWriter = resultsWriter;
        this.listeners = List.copyOf(listeners);
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public PipelineOutcome start(Path workDir, PipelineDefinition definition) {
        return start(workDir, definition, List.of());
    }

    /**
     * Initializes a fresh run in {@code workDir} and drives it until it completes, fails or parks.
     *
     * @param skipStages stages whose prerequisites the caller has already satisfied
     */
    public PipelineOutcome start(Path workDir, PipelineDefinition definition, Collection<String> skipStages) {
        PipelineDefinitionLoader.validate(definition);
        for (String skip : skipStages) {
            if (!definition.stageNames().contains(skip)) {
                throw new PipelineDefinitionException("Cannot skip unknown stage " + skip);
            }
        }

        Path location = locate(workDir);
        try (RunLock lock = stateStore.lock(location)) {
            PipelineRun run = stateStore.initialize(location, definition.stageNames());
            log.info("Starting pipeline '{}' as run {} in {}", definition.getName(), run.getRunId(), location);

            if (!skipStages.isEmpty()) {
                for (String skip : skipStages) {
                    markSkipped(run.findStage(skip).orElseThrow());
                    log.info("Stage {} skipped at start of run {}", skip, run.getRunId());
                }
                advancePointer(run);
                stateStore.save(location, run);
            }
            return drive(location, run, definition);
        }
    }

    /**
     * Continues a persisted run. Safe to call repeatedly: a finished or parked run is returned as is.
     */
    public PipelineOutcome resume(Path workDir, PipelineDefinition definition) {
        Path location = locate(workDir);
        try (RunLock lock = stateStore.lock(location)) {
            PipelineRun run = stateStore.load(location);
            verifyMatches(run, definition);

            if (run.getAwaitingApprovalAfter() != null) {
                log.info("Run {} is waiting for approval after stage {}; nothing to resume",
                    run.getRunId(), run.getAwaitingApprovalAfter());
                return finish(location, outcome(run, PipelineStatus.AWAITING_APPROVAL, 0));
            }

            log.info("Resuming run {} in {} at stage {}", run.getRunId(), location, run.getCurrentStage());
            return drive(location, run, definition);
        }
    }

    /**
     * Grants the checkpoint the run is parked at and continues with the next stage.
     */
    public PipelineOutcome approve(Path workDir, PipelineDefinition definition) {
        Path location = locate(workDir);
        try (RunLock lock = stateStore.lock(location)) {
            PipelineRun run = stateStore.load(location);
            verifyMatches(run, definition);

            String gate = run.getAwaitingApprovalAfter();
            if (gate == null) {
                throw new PipelineStateException("Run " + run.getRunId() + " is not waiting for approval");
            }

            run.getApprovedCheckpoints().add(gate);
            run.setAwaitingApprovalAfter(null);
            stateStore.save(location, run);
            log.info("Checkpoint after stage {} approved for run {}", gate, run.getRunId());

            return drive(location, run, definition);
        }
    }

    /**
     * Declines the checkpoint the run is parked at. The stage behind the gate is failed with
     * {@link StageErrorKind#CHECKPOINT_REJECTED} and the run halts; a later resume parks at the same
     * gate again.
     */
    public PipelineOutcome reject(Path workDir, String reason) {
        Path location = locate(workDir);
        try (RunLock lock = stateStore.lock(location)) {
            PipelineRun run = stateStore.load(location);

            String gate = run.getAwaitingApprovalAfter();
            if (gate == null) {
                throw new PipelineStateException("Run " + run.getRunId() + " is not waiting for approval");
            }
            StageRecord next = nextUnsettled(run)
                .orElseThrow(() -> new PipelineStateException("Run " + run.getRunId() + " has no stage after " + gate));

            Instant now = Instant.now();
            next.setStatus(StageStatus.FAILED);
            next.setSuccess(false);
            next.setCompletedAt(now);
            next.setOutputs(new LinkedHashMap<>());
            next.setErrorKind(StageErrorKind.CHECKPOINT_REJECTED);
            next.setError("checkpoint after stage " + gate + " rejected: "
                + (reason != null && !reason.isBlank() ? reason : "no reason given"));
            if (next.getStartedAt() == null) {
                next.setStartedAt(now);
            }
            run.setAwaitingApprovalAfter(null);
            run.setCurrentStage(null);
            stateStore.save(location, run);
            listeners.forEach(listener -> listener.onStageFinished(run, next));
            log.warn("Checkpoint after stage {} rejected for run {}: {}", gate, run.getRunId(), next.getError());

            return finish(location, outcome(run, PipelineStatus.FAILED, 0));
        }
    }

    /**
     * Marks a pending or failed stage as skipped. A skipped stage is distinguishable from one that
     * ran and succeeded.
     */
    public PipelineRun skipStage(Path workDir, String stageName) {
        Path location = locate(workDir);
        try (RunLock lock = stateStore.lock(location)) {
            PipelineRun run = stateStore.load(location);
            StageRecord record = run.findStage(stageName)
                .orElseThrow(() -> new PipelineStateException("Run " + run.getRunId() + " has no stage " + stageName));

            if (record.getStatus() != StageStatus.PENDING && record.getStatus() != StageStatus.FAILED) {
                throw new PipelineStateException("Stage " + stageName + " is " + record.getStatus().name().toLowerCase()
                    + " and cannot be skipped");
            }

            markSkipped(record);
            advancePointer(run);
            stateStore.save(location, run);
            log.info("Stage {} of run {} skipped", stageName, run.getRunId());
            return run;
        }
    }

    /**
     * Requests cancellation of the stage currently executing for {@code workDir}. The stage goes
     * through the same termination procedure as a timeout and the run halts with it failed.
     *
     * @return false when nothing is executing for that run in this orchestrator
     */
    public boolean abort(Path workDir, String reason) {
        StageCancellation cancellation = activeStages.get(locate(workDir));
        if (cancellation == null) {
            return false;
        }
        boolean first = cancellation.cancel(reason);
        if (first) {
            log.warn("Abort requested for run in {}: {}", workDir, reason);
        }
        return first;
    }

    public boolean isExecuting(Path workDir) {
        return activeStages.containsKey(locate(workDir));
    }

    public PipelineRun status(Path workDir) {
        return stateStore.load(locate(workDir));
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private PipelineOutcome drive(Path location, PipelineRun run, PipelineDefinition definition) {
        verifyMatches(run, definition);
        List<StageRecord> stages = run.getStages();
        int executed = 0;

        for (int i = 0; i < stages.size(); i++) {
            StageRecord record = stages.get(i);
            StageDefinition stageDefinition = definition.getStages().get(i);

            if (!record.getStatus().isSettled()) {
                executed += execute(location, run, record, stageDefinition);

                if (record.getStatus() == StageStatus.FAILED) {
                    return finish(location, outcome(run, PipelineStatus.FAILED, executed));
                }
            }

            if (record.getStatus() == StageStatus.COMPLETED && needsApproval(run, stageDefinition, i)) {
                return finish(location, park(location, run, stageDefinition, executed));
            }
        }

        if (!run.isCompleted()) {
            markCompleted(run);
            stateStore.save(location, run);
        }
        return finish(location, outcome(run, PipelineStatus.COMPLETED, executed));
    }

    /**
     * Runs one stage, re-running it while attempts remain. Each attempt is saved as running
     * before launch and saved again with its terminal result.
     *
     * @return number of attempts started
     */
    private int execute(Path location, PipelineRun run, StageRecord record, StageDefinition stageDefinition) {
        int attempts = 0;

        while (true) {
            if (record.getStatus() == StageStatus.RUNNING) {
                log.warn("Stage {} of run {} was left running by a previous orchestrator; re-executing from scratch",
                    record.getName(), run.getRunId());
            } else if (record.getStatus() == StageStatus.FAILED && attempts == 0) {
                log.info("Re-executing failed stage {} of run {}", record.getName(), run.getRunId());
            }

            attempts++;
            beginAttempt(run, record);
            stateStore.save(location, run);
            listeners.forEach(listener -> listener.onStageStarted(run, record));

            StageCancellation cancellation = new StageCancellation();
            activeStages.put(location, cancellation);
            StageResult result;
            try {
                result = runAttempt(location, run, stageDefinition, cancellation, record.getStartedAt());
            } finally {
                activeStages.remove(location, cancellation);
            }

            result.applyTo(record);
            if (result.isSuccess()) {
                advancePointer(run);
            } else {
                run.setCurrentStage(null);
            }
            stateStore.save(location, run);
            listeners.forEach(listener -> listener.onStageFinished(run, record));

            if (result.isSuccess() || cancellation.isCancelled() || attempts >= stageDefinition.getMaxAttempts()) {
                return attempts;
            }
            log.warn("Stage {} failed (attempt {}/{}), retrying. Reason: {}",
                record.getName(), attempts, stageDefinition.getMaxAttempts(), record.getError());
        }
    }

    private StageResult runAttempt(Path location, PipelineRun run, StageDefinition stageDefinition,
                                   StageCancellation cancellation, Instant startedAt) {
        StageRequest request;
        try {
            request = buildRequest(location, run, stageDefinition);
        } catch (IOException e) {
            return StageResult.failed(stageDefinition.getName(), startedAt, StageErrorKind.LAUNCH_FAILED,
                "could not read stage input " + stageDefinition.getInputFile() + ": " + e.getMessage());
        }

        try {
            return stageExecutor.runStage(request, cancellation);
        } catch (RuntimeException e) {
            log.error("Unhandled error supervising stage {}: {}", stageDefinition.getName(), e.getMessage(), e);
            return StageResult.failed(stageDefinition.getName(), startedAt, null,
                "stage supervision failed: " + e.getMessage());
        }
    }

    private PipelineOutcome park(Path location, PipelineRun run, StageDefinition gate, int executed) {
        // A stage failed by an earlier rejection is not pointed at
        String next = nextUnsettled(run)
            .filter(stage -> stage.getStatus() != StageStatus.FAILED)
            .map(StageRecord::getName)
            .orElse(null);
        boolean alreadyParked = gate.getName().equals(run.getAwaitingApprovalAfter())
            && Objects.equals(next, run.getCurrentStage());

        if (!alreadyParked) {
            run.setAwaitingApprovalAfter(gate.getName());
            run.setCurrentStage(next);
            stateStore.save(location, run);
        }
        return outcome(run, PipelineStatus.AWAITING_APPROVAL, executed);
    }

    private PipelineOutcome finish(Path location, PipelineOutcome outcome) {
        resultsWriter.write(location, outcome);
        listeners.forEach(listener -> listener.onPipelineReturned(outcome));
        return outcome;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void beginAttempt(PipelineRun run, StageRecord record) {
        record.setStatus(StageStatus.RUNNING);
        record.setStartedAt(Instant.now());
        record.setCompletedAt(null);
        record.setSuccess(null);
        record.setOutputs(new LinkedHashMap<>());
        record.setError(null);
        record.setErrorKind(null);
        record.setExitCode(null);
        record.setMarkerMetadata(new LinkedHashMap<>());
        record.setAttemptCount(record.getAttemptCount() + 1);
        run.setCurrentStage(record.getName());
        run.setAwaitingApprovalAfter(null);
    }

    private boolean needsApproval(PipelineRun run, StageDefinition stageDefinition, int index) {
        if (!stageDefinition.isApprovalGate() || run.getApprovedCheckpoints().contains(stageDefinition.getName())) {
            return false;
        }
        List<StageRecord> stages = run.getStages();
        return stages.subList(index + 1, stages.size()).stream()
            .anyMatch(stage -> !stage.getStatus().isSettled());
    }

    /**
     * Points the run at its first unsettled stage; marks the run completed when none is left.
     */
    private void advancePointer(PipelineRun run) {
        Optional<StageRecord> next = nextUnsettled(run);
        if (next.isPresent()) {
            run.setCurrentStage(next.get().getName());
        } else {
            markCompleted(run);
        }
    }

    private void markCompleted(PipelineRun run) {
        run.setCurrentStage(null);
        run.setAwaitingApprovalAfter(null);
        run.setCompleted(true);
        run.setCompletedAt(Instant.now());
    }

    private void markSkipped(StageRecord record) {
        record.setStatus(StageStatus.SKIPPED);
        record.setCompletedAt(Instant.now());
        record.setSuccess(null);
        record.setOutputs(new LinkedHashMap<>());
        record.setError(null);
        record.setErrorKind(null);
    }

    private Optional<StageRecord> nextUnsettled(PipelineRun run) {
        return run.getStages().stream()
            .filter(stage -> !stage.getStatus().isSettled())
            .findFirst();
    }

    private StageRequest buildRequest(Path location, PipelineRun run, StageDefinition stageDefinition) throws IOException {
        Map<String, String> placeholders = Map.of(
            "{workDir}", location.toString(),
            "{runId}", run.getRunId(),
            "{stage}", stageDefinition.getName()
        );

        String input = null;
        if (stageDefinition.getInputFile() != null) {
            Path inputFile = location.resolve(substitute(stageDefinition.getInputFile(), placeholders));
            input = Files.readString(inputFile, StandardCharsets.UTF_8);
        }

        return StageRequest.builder()
            .stageName(stageDefinition.getName())
            .command(stageDefinition.getCommand().stream()
                .map(arg -> substitute(arg, placeholders))
                .collect(Collectors.toList()))
            .workingDir(location)
            .timeout(stageDefinition.resolveTimeout())
            .markerName(stageDefinition.resolveMarkerName())
            .requiredOutputs(new LinkedHashMap<>(stageDefinition.getRequiredOutputs()))
            .allowExitCodeSuccess(stageDefinition.isAllowExitCodeSuccess())
            .input(input)
            .environment(new LinkedHashMap<>(stageDefinition.getEnvironment()))
            .strippedEnvironment(List.copyOf(stageDefinition.getStrippedEnvironment()))
            .build();
    }

    private static String substitute(String value, Map<String, String> placeholders) {
        String result = value;
        for (Map.Entry<String, String> placeholder : placeholders.entrySet()) {
            result = result.replace(placeholder.getKey(), placeholder.getValue());
        }
        return result;
    }

    private void verifyMatches(PipelineRun run, PipelineDefinition definition) {
        List<String> recorded = run.getStages().stream()
            .map(StageRecord::getName)
            .collect(Collectors.toList());
        if (!recorded.equals(definition.stageNames())) {
            throw new PipelineDefinitionException("Pipeline '" + definition.getName() + "' declares stages "
                + definition.stageNames() + " but run " + run.getRunId() + " recorded " + recorded);
        }
    }

    private PipelineOutcome outcome(PipelineRun run, PipelineStatus status, int executed) {
        Optional<StageRecord> failed = status == PipelineStatus.FAILED
            ? run.getStages().stream().filter(stage -> stage.getStatus() == StageStatus.FAILED).findFirst()
            : Optional.empty();

        return PipelineOutcome.builder()
            .runId(run.getRunId())
            .status(status)
            .failedStage(failed.map(StageRecord::getName).orElse(null))
            .error(failed.map(StageRecord::getError).orElse(null))
            .stagesExecuted(executed)
            .run(run)
            .build();
    }

    private static Path locate(Path workDir) {
        return workDir.toAbsolutePath().normalize();
    }
}
