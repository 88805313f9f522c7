package com.autonomous.pipeline.service;

/**
 * The requested operation does not apply to the run in its current state,
 * e.g. approving a run that is not parked at a checkpoint.
 */
public class PipelineStateException extends RuntimeException {

    public PipelineStateException(String message) {
        super(message);
    }
}
