package com.autonomous.pipeline.integration;

import com.autonomous.pipeline.model.PipelineDefinition;
import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.PipelineStatus;
import com.autonomous.pipeline.model.RunSubmission;
import com.autonomous.pipeline.model.StageDefinition;
import com.autonomous.pipeline.model.StageErrorKind;
import com.autonomous.pipeline.model.StageRecord;
import com.autonomous.pipeline.model.StageStatus;
import com.autonomous.pipeline.service.PipelineDefinitionLoader;
import com.autonomous.pipeline.service.PipelineOrchestratorService;
import com.autonomous.pipeline.service.PipelineSubmissionService;
import com.autonomous.pipeline.store.StateStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class PipelineEndToEndTest {

    @Autowired
    private PipelineOrchestratorService orchestrator;

    @Autowired
    private PipelineSubmissionService submissions;

    @Autowired
    private PipelineDefinitionLoader definitions;

    @Autowired
    private StateStore stateStore;

    @TempDir
    Path workDir;

    @Test
    void shouldLoadOnlyValidDefinitions() {
        assertTrue(definitions.getDefinition("smoke").isPresent());
        assertFalse(definitions.getDefinition("broken").isPresent());
    }

    @Test
    void shouldRunFreshTwoStagePipeline() throws Exception {
        PipelineOutcome outcome = orchestrator.start(workDir, definitions.requireDefinition("smoke"));

        assertEquals(PipelineStatus.COMPLETED, outcome.getStatus());
        assertTrue(Files.exists(workDir.resolve("summary.txt")));

        PipelineRun persisted = stateStore.load(workDir);
        assertTrue(persisted.isCompleted());
        assertEquals(2, persisted.countStages(StageStatus.COMPLETED));
        StageRecord execute = persisted.findStage("execute").orElseThrow();
        assertEquals(workDir.resolve("summary.txt").toAbsolutePath().toString(), execute.getOutputs().get("summary"));
        assertEquals("ok", persisted.findStage("gather").orElseThrow().getMarkerMetadata().get("status"));

        assertTrue(Files.readString(workDir.resolve("logs/gather.log")).contains("gathering"));
        assertTrue(Files.readString(workDir.resolve("logs/execute.log")).contains("notes"));
        assertTrue(Files.exists(workDir.resolve(".pipeline/pipeline_results.json")));
    }

    @Test
    void shouldHaltWhenStageTimesOut() {
        StageDefinition gather = stage("gather", "exec sleep 30");
        gather.setTimeoutSeconds(1);
        PipelineDefinition definition = pipeline(gather, stage("execute", "touch summary.txt .execute_complete"));

        PipelineOutcome outcome = orchestrator.start(workDir, definition);

        assertEquals(PipelineStatus.FAILED, outcome.getStatus());
        assertEquals("gather", outcome.getFailedStage());
        PipelineRun persisted = stateStore.load(workDir);
        StageRecord failed = persisted.findStage("gather").orElseThrow();
        assertEquals(StageErrorKind.STAGE_TIMEOUT, failed.getErrorKind());
        assertEquals("stage exceeded timeout of 1sec", failed.getError());
        assertEquals(StageStatus.PENDING, persisted.findStage("execute").orElseThrow().getStatus());
        assertNull(persisted.getCurrentStage());
        assertFalse(Files.exists(workDir.resolve("summary.txt")));
    }

    @Test
    void shouldFailStageWhoseMarkerClaimsMissingOutputs() {
        StageDefinition gather = stage("gather", "touch .gather_complete");
        gather.getRequiredOutputs().put("resources", "resources.md");

        PipelineOutcome outcome = orchestrator.start(workDir, pipeline(gather));

        assertEquals(PipelineStatus.FAILED, outcome.getStatus());
        StageRecord failed = stateStore.load(workDir).findStage("gather").orElseThrow();
        assertEquals(StageErrorKind.STAGE_INCOMPLETE_OUTPUTS, failed.getErrorKind());
        assertTrue(failed.getError().contains("resources.md"));
    }

    @Test
    void shouldNotPointAtStageThatExitedWithoutMarker() {
        PipelineDefinition definition = pipeline(stage("gather", "exit 3"), stage("execute", "touch .execute_complete"));

        PipelineOutcome outcome = orchestrator.start(workDir, definition);

        assertEquals("gather", outcome.getFailedStage());
        PipelineRun persisted = stateStore.load(workDir);
        assertNull(persisted.getCurrentStage());
        assertEquals(3, persisted.findStage("gather").orElseThrow().getExitCode());
        assertEquals(StageErrorKind.PROCESS_EXITED_WITHOUT_MARKER,
            persisted.findStage("gather").orElseThrow().getErrorKind());
    }

    @Test
    void shouldResumeAfterCrashWithoutRepeatingCompletedStage() throws Exception {
        PipelineDefinition definition = pipeline(
            stage("gather", "touch gather-ran .gather_complete"),
            stage("execute", "echo done > summary.txt; touch .execute_complete"));
        definition.getStages().get(1).getRequiredOutputs().put("summary", "summary.txt");

        // State as left by an orchestrator that died while execute was running
        PipelineRun crashed = stateStore.initialize(workDir, definition.stageNames());
        StageRecord gather = crashed.findStage("gather").orElseThrow();
        gather.setStatus(StageStatus.COMPLETED);
        gather.setSuccess(true);
        gather.setCompletedAt(Instant.now());
        StageRecord execute = crashed.findStage("execute").orElseThrow();
        execute.setStatus(StageStatus.RUNNING);
        execute.setStartedAt(Instant.now());
        crashed.setCurrentStage("execute");
        stateStore.save(workDir, crashed);

        PipelineOutcome outcome = orchestrator.resume(workDir, definition);

        assertEquals(PipelineStatus.COMPLETED, outcome.getStatus());
        assertFalse(Files.exists(workDir.resolve("gather-ran")));
        assertTrue(Files.exists(workDir.resolve("summary.txt")));
        assertTrue(stateStore.load(workDir).isCompleted());
    }

    @Test
    void shouldRunSubmittedPipelineInBackground() throws Exception {
        RunSubmission submission = submissions.submitStart(workDir, "smoke", List.of());

        PipelineOutcome outcome = submission.getFuture().get(30, TimeUnit.SECONDS);

        assertEquals(PipelineStatus.COMPLETED, outcome.getStatus());
        assertFalse(submissions.hasActiveRun(workDir));
        assertTrue(submissions.status(workDir).isCompleted());
    }

    private static StageDefinition stage(String name, String script) {
        StageDefinition stage = new StageDefinition();
        stage.setName(name);
        stage.setCommand(List.of("sh", "-c", script));
        stage.setTimeoutSeconds(30);
        return stage;
    }

    private static PipelineDefinition pipeline(StageDefinition... stages) {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("inline");
        definition.setStages(new ArrayList<>(List.of(stages)));
        return definition;
    }
}
