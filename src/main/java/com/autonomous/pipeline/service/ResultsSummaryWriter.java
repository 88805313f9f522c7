package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.StageRecord;
import com.autonomous.pipeline.store.FileStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code .pipeline/pipeline_results.json} next to the run state whenever an orchestrator
 * call returns. It is a convenience snapshot for publishers and humans; the state file stays the
 * source of truth, so a failed write is only logged.
 */
@Component
public class ResultsSummaryWriter {

    public static final String RESULTS_FILE = "pipeline_results.json";

    private static final Logger log = LoggerFactory.getLogger(ResultsSummaryWriter.class);

    private final ObjectMapper mapper;

    public ResultsSummaryWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(Path workDir, PipelineOutcome outcome) {
        Path resultsFile = FileStateStore.stateDirectory(workDir).resolve(RESULTS_FILE);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", outcome.getRunId());
        summary.put("status", outcome.getStatus().name().toLowerCase());
        summary.put("success", outcome.getRun().isCompleted());
        summary.put("work_dir", workDir.toAbsolutePath().toString());
        summary.put("failed_stage", outcome.getFailedStage());
        summary.put("error", outcome.getError());
        summary.put("written_at", Instant.now());

        List<Map<String, Object>> stages = new ArrayList<>();
        for (StageRecord stage : outcome.getRun().getStages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", stage.getName());
            entry.put("status", stage.getStatus());
            entry.put("success", stage.getSuccess());
            entry.put("outputs", stage.getOutputs());
            entry.put("error", stage.getError());
            entry.put("log_file", stage.getLogFile());
            stages.add(entry);
        }
        summary.put("stages", stages);

        try {
            Files.createDirectories(resultsFile.getParent());
            mapper.writeValue(resultsFile.toFile(), summary);
        } catch (IOException e) {
            log.warn("Failed to write pipeline results {}: {}", resultsFile, e.getMessage());
        }
        return resultsFile;
    }
}
