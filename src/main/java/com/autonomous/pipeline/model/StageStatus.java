package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress of a single stage within a run.
 *
 * Transitions:
 *   PENDING  → RUNNING    (executor invoked)
 *   RUNNING  → COMPLETED  (marker seen and outputs verified)
 *   RUNNING  → FAILED     (timeout, missing outputs, exit without marker, abort)
 *   PENDING  → SKIPPED    (caller satisfied the stage externally)
 *   FAILED   → RUNNING    (operator resume or bounded retry)
 *   FAILED   → SKIPPED
 *
 * COMPLETED and SKIPPED are never reopened.
 */
public enum StageStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("running")
    RUNNING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("skipped")
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /** Terminal and never executed again: the orchestrator passes over these on resume. */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }
}
