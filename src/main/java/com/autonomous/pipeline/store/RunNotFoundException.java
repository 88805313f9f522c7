package com.autonomous.pipeline.store;

import java.nio.file.Path;

public class RunNotFoundException extends StateStoreException {

    public RunNotFoundException(Path runLocation) {
        super("No pipeline run recorded in " + runLocation);
    }
}
