package com.autonomous.pipeline.store;

import com.autonomous.pipeline.model.PipelineRun;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable, crash-consistent record of a pipeline run. A run location is the run's working directory.
 */
public interface StateStore {

    /**
     * @throws RunNotFoundException   if nothing has been recorded at the location yet
     * @throws StateCorruptException if the record cannot be parsed
     */
    PipelineRun load(Path runLocation);

    /**
     * Writes the full run atomically. Once this returns, {@link #load} observes exactly this run,
     * even if the process dies immediately afterwards.
     */
    void save(Path runLocation, PipelineRun run);

    /**
     * Creates and persists a fresh run with every stage pending.
     *
     * @throws RunAlreadyExistsException if a non-empty record is already present
     */
    PipelineRun initialize(Path runLocation, List<String> stageNames);

    boolean exists(Path runLocation);

    /**
     * Takes the run's advisory lock without blocking.
     *
     * @throws RunLockedException if another holder has it
     */
    RunLock lock(Path runLocation);
}
