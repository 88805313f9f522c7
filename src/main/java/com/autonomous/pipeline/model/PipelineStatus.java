package com.autonomous.pipeline.model;

/**
 * Where an orchestrator call left the run when it returned.
 */
public enum PipelineStatus {
    COMPLETED,
    FAILED,
    AWAITING_APPROVAL
}
