package com.autonomous.pipeline.store;

/**
 * Exclusive hold on a run for the duration of one orchestrator call.
 */
public interface RunLock extends AutoCloseable {

    @Override
    void close();
}
