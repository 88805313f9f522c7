package com.autonomous.pipeline.store;

import java.nio.file.Path;

/**
 * Another orchestrator currently holds the run's advisory lock.
 */
public class RunLockedException extends StateStoreException {

    public RunLockedException(Path runLocation) {
        super("Pipeline run in " + runLocation + " is held by another orchestrator");
    }
}
