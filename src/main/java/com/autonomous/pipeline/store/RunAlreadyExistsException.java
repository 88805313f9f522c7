package com.autonomous.pipeline.store;

import java.nio.file.Path;

public class RunAlreadyExistsException extends StateStoreException {

    public RunAlreadyExistsException(Path runLocation) {
        super("A pipeline run is already recorded in " + runLocation + "; resume it or choose a fresh directory");
    }
}
