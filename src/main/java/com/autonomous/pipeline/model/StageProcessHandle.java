package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One spawned external process, held by the stage executor for a single invocation
 * and discarded once the process has exited or been killed. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageProcessHandle {
    private String stageName;
    private long pid;
    private Instant startedAt;
    private Duration timeout;
    private transient Process process;
    private transient StageCancellation cancellation;

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }
}
