package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineOutcome {
    private String runId;
    private PipelineStatus status;
    private String failedStage;
    private String error;
    private int stagesExecuted;
    private PipelineRun run;
}
