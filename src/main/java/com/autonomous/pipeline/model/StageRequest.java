package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageRequest {
    private String stageName;
    private List<String> command;
    private Path workingDir;
    private Duration timeout;
    private String markerName;
    @Builder.Default
    private Map<String, String> requiredOutputs = new LinkedHashMap<>();
    private boolean allowExitCodeSuccess;
    private String input;         // piped to stdin when present
    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();
    @Builder.Default
    private List<String> strippedEnvironment = new ArrayList<>();
}
