package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageRecord {
    private String name;
    @Builder.Default
    private StageStatus status = StageStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private Boolean success;      // null until terminal
    @Builder.Default
    private Map<String, String> outputs = new LinkedHashMap<>();
    private String error;
    private StageErrorKind errorKind;
    private Integer exitCode;
    private int attemptCount;
    private String logFile;
    @Builder.Default
    private Map<String, String> markerMetadata = new LinkedHashMap<>();

    public static StageRecord pending(String name) {
        return StageRecord.builder().name(name).build();
    }
}
