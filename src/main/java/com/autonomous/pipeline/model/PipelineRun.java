package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One execution of a pipeline against a working directory.
 *
 * The orchestrator owns the in-memory copy; the state store owns the durable one.
 * Stage records are kept in execution order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;
    private String runId;
    private Instant createdAt;
    private Instant updatedAt;
    private String currentStage;
    private boolean completed;
    private Instant completedAt;

    // Name of the gated stage the run is parked behind, null when not parked.
    private String awaitingApprovalAfter;

    @Builder.Default
    private List<String> approvedCheckpoints = new ArrayList<>();

    @Builder.Default
    private List<StageRecord> stages = new ArrayList<>();

    public Optional<StageRecord> findStage(String name) {
        return stages.stream()
            .filter(stage -> stage.getName().equals(name))
            .findFirst();
    }

    public long countStages(StageStatus status) {
        return stages.stream()
            .filter(stage -> stage.getStatus() == status)
            .count();
    }
}
