package com.autonomous.pipeline.completion;

import com.autonomous.pipeline.model.StageProcessHandle;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Decides when an external agent has finished its logical unit of work.
 *
 * Agents report completion by side effect rather than by return value, so the stage executor
 * depends only on this contract and not on how the signal is transported.
 */
public interface CompletionSignal {

    /**
     * Blocks until the marker appears, the process exits, the deadline passes or the handle is
     * cancelled, whichever happens first. Never terminates the process itself.
     */
    CompletionOutcome awaitCompletion(StageProcessHandle handle, Path workingDir, String markerName, Instant deadline)
        throws InterruptedException;
}
