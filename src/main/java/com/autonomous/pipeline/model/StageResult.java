package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal outcome of one supervised stage execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageResult {
    private String stageName;
    private boolean success;
    private Instant startedAt;
    private Instant completedAt;
    @Builder.Default
    private Map<String, String> outputs = new LinkedHashMap<>();
    private String error;
    private StageErrorKind errorKind;
    private Integer exitCode;
    private String logFile;
    @Builder.Default
    private Map<String, String> markerMetadata = new LinkedHashMap<>();

    public static StageResult failed(String stageName, Instant startedAt, StageErrorKind kind, String error) {
        return StageResult.builder()
            .stageName(stageName)
            .success(false)
            .startedAt(startedAt)
            .completedAt(Instant.now())
            .errorKind(kind)
            .error(error)
            .build();
    }

    public StageStatus status() {
        return success ? StageStatus.COMPLETED : StageStatus.FAILED;
    }

    public void applyTo(StageRecord record) {
        record.setStatus(status());
        record.setStartedAt(startedAt);
        record.setCompletedAt(completedAt);
        record.setSuccess(success);
        record.setOutputs(success ? new LinkedHashMap<>(outputs) : new LinkedHashMap<>());
        record.setError(error);
        record.setErrorKind(errorKind);
        record.setExitCode(exitCode);
        record.setLogFile(logFile);
        record.setMarkerMetadata(new LinkedHashMap<>(markerMetadata));
    }
}
