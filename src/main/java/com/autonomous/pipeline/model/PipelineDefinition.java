package com.autonomous.pipeline.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
public class PipelineDefinition {
    private String name;
    private String description;
    private List<StageDefinition> stages = new ArrayList<>();

    public List<String> stageNames() {
        return stages.stream()
            .map(StageDefinition::getName)
            .collect(Collectors.toList());
    }
}
