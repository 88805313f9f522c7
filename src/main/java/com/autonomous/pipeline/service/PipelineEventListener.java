package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.StageRecord;

/**
 * Callbacks from the orchestrator. Every callback fires only after the state it describes
 * has been saved, so a listener never sees progress that a reload would not.
 */
public interface PipelineEventListener {

    default void onStageStarted(PipelineRun run, StageRecord stage) {
    }

    default void onStageFinished(PipelineRun run, StageRecord stage) {
    }

    default void onPipelineReturned(PipelineOutcome outcome) {
    }
}
