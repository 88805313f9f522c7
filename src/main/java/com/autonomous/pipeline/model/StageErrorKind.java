package com.autonomous.pipeline.model;

/**
 * Machine-readable reason attached to a failed stage, next to its human-readable error.
 */
public enum StageErrorKind {
    STAGE_TIMEOUT,
    STAGE_INCOMPLETE_OUTPUTS,
    PROCESS_EXITED_WITHOUT_MARKER,
    STAGE_CANCELLED,
    LAUNCH_FAILED,
    CHECKPOINT_REJECTED
}
