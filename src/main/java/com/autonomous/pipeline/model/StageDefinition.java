package com.autonomous.pipeline.model;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class StageDefinition {
    private String name;

    // Argument list; {workDir}, {runId} and {stage} are substituted at launch
    private List<String> command = new ArrayList<>();

    // ISO-8601 duration or plain seconds; takes precedence over timeoutSeconds
    private Duration timeout;
    private long timeoutSeconds = 2700;
    private String markerName;

    // Logical output name -> path relative to the working directory
    private Map<String, String> requiredOutputs = new LinkedHashMap<>();

    // Behavior
    private boolean allowExitCodeSuccess = false;
    private boolean approvalGate = false;
    private int maxAttempts = 1;

    // Optional
    private String inputFile;
    private Map<String, String> environment = new LinkedHashMap<>();
    private List<String> strippedEnvironment = new ArrayList<>();

    public Duration resolveTimeout() {
        return timeout != null ? timeout : Duration.ofSeconds(timeoutSeconds);
    }

    public String resolveMarkerName() {
        return markerName != null && !markerName.isBlank() ? markerName : "." + name + "_complete";
    }
}
