package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineDefinition;
import com.autonomous.pipeline.model.StageDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDefinitionLoaderTest {

    private PipelineDefinitionLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new PipelineDefinitionLoader();
        loader.setConfigPath(tempDir.toString());
    }

    @Test
    void shouldLoadDefinitionFromYaml() throws Exception {
        Files.writeString(tempDir.resolve("research.yaml"), String.join("\n",
            "name: research",
            "stages:",
            "  - name: resource-gathering",
            "    command: [\"claude\", \"--print\"]",
            "    input_file: prompts/resource_finder.txt",
            "    timeout_seconds: 1800",
            "    marker_name: .resource_finder_complete",
            "    approval_gate: true",
            "    required_outputs:",
            "      resources: resources.md",
            "  - name: experiment-execution",
            "    command: [\"claude\", \"--print\"]",
            "    max_attempts: 2",
            ""));

        loader.loadDefinitions();
        Optional<PipelineDefinition> definition = loader.getDefinition("research");

        assertTrue(definition.isPresent());
        assertEquals(List.of("resource-gathering", "experiment-execution"), definition.get().stageNames());

        StageDefinition gathering = definition.get().getStages().get(0);
        assertEquals(1800, gathering.getTimeoutSeconds());
        assertEquals(".resource_finder_complete", gathering.resolveMarkerName());
        assertTrue(gathering.isApprovalGate());
        assertEquals(Map.of("resources", "resources.md"), gathering.getRequiredOutputs());
        assertEquals("prompts/resource_finder.txt", gathering.getInputFile());

        StageDefinition execution = definition.get().getStages().get(1);
        assertEquals(2700, execution.getTimeoutSeconds());
        assertEquals(".experiment-execution_complete", execution.resolveMarkerName());
        assertEquals(2, execution.getMaxAttempts());
        assertFalse(execution.isAllowExitCodeSuccess());
    }

    @Test
    void shouldReadTimeoutAsDurationOrSeconds() throws Exception {
        Files.writeString(tempDir.resolve("timeouts.yaml"), String.join("\n",
            "name: timeouts",
            "stages:",
            "  - name: iso",
            "    command: [\"true\"]",
            "    timeout: PT30M",
            "  - name: seconds",
            "    command: [\"true\"]",
            "    timeout: 90",
            "  - name: legacy",
            "    command: [\"true\"]",
            "    timeout_seconds: 120",
            "  - name: both",
            "    command: [\"true\"]",
            "    timeout: PT1M",
            "    timeout_seconds: 600",
            ""));

        loader.loadDefinitions();
        List<StageDefinition> stages = loader.requireDefinition("timeouts").getStages();

        assertEquals(Duration.ofMinutes(30), stages.get(0).resolveTimeout());
        assertEquals(Duration.ofSeconds(90), stages.get(1).resolveTimeout());
        assertEquals(Duration.ofSeconds(120), stages.get(2).resolveTimeout());
        assertEquals(Duration.ofMinutes(1), stages.get(3).resolveTimeout());
    }

    @Test
    void shouldRejectStageNamesThatLeaveWorkingDirectory() {
        for (String name : List.of("../escape", "logs/gather", "a\\b", "..")) {
            PipelineDefinition definition = new PipelineDefinition();
            definition.setName("bad");
            StageDefinition stage = new StageDefinition();
            stage.setName(name);
            stage.setCommand(List.of("agent"));
            definition.setStages(List.of(stage));

            assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionLoader.validate(definition), name);
        }
    }

    @Test
    void shouldRejectMarkerOutsideWorkingDirectory() {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("bad");
        StageDefinition stage = new StageDefinition();
        stage.setName("gather");
        stage.setCommand(List.of("agent"));
        stage.setMarkerName("../.gather_complete");
        definition.setStages(List.of(stage));

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionLoader.validate(definition));
    }

    @Test
    void shouldNameDefinitionAfterFileWhenNameMissing() throws Exception {
        Files.writeString(tempDir.resolve("quick.yml"), "stages:\n  - name: only\n    command: [\"true\"]\n");

        loader.loadDefinitions();

        assertTrue(loader.getDefinition("quick").isPresent());
    }

    @Test
    void shouldSkipInvalidDefinitionsAndKeepValidOnes() throws Exception {
        Files.writeString(tempDir.resolve("valid.yaml"), "name: valid\nstages:\n  - name: a\n    command: [\"true\"]\n");
        Files.writeString(tempDir.resolve("duplicate.yaml"),
            "name: duplicate\nstages:\n  - name: a\n    command: [\"true\"]\n  - name: a\n    command: [\"true\"]\n");
        Files.writeString(tempDir.resolve("garbled.yaml"), "name: [unclosed\n");

        loader.loadDefinitions();

        assertEquals(List.of("valid"), List.copyOf(loader.getAllDefinitions().keySet()));
    }

    @Test
    void shouldRejectUnknownDefinition() {
        loader.loadDefinitions();

        assertThrows(PipelineDefinitionException.class, () -> loader.requireDefinition("missing"));
    }

    @Test
    void shouldRejectStageWithoutCommand() {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("bad");
        StageDefinition stage = new StageDefinition();
        stage.setName("gather");
        definition.setStages(List.of(stage));

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionLoader.validate(definition));
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("bad");
        StageDefinition stage = new StageDefinition();
        stage.setName("gather");
        stage.setCommand(List.of("agent"));
        stage.setTimeoutSeconds(0);
        definition.setStages(List.of(stage));

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionLoader.validate(definition));
    }
}
