package com.autonomous.pipeline.service;

/**
 * A pipeline definition is invalid or does not match the run it is applied to.
 */
public class PipelineDefinitionException extends RuntimeException {

    public PipelineDefinitionException(String message) {
        super(message);
    }
}
