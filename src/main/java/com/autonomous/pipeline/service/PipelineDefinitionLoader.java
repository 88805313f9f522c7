package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineDefinition;
import com.autonomous.pipeline.model.StageDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads pipeline definitions (ordered stages with their commands, timeouts, markers and output
 * contracts) from YAML files in the definitions directory. A file that fails to parse or validate
 * is skipped with an error; the others still load.
 */
@Service
public class PipelineDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitionLoader.class);

    @Value("${pipeline.definitions.path:config/pipelines}")
    private String configPath;

    private final Map<String, PipelineDefinition> definitions = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public PipelineDefinitionLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.registerModule(new JavaTimeModule());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadDefinitions() {
        definitions.clear();
        File configDir = new File(configPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.warn("Pipeline definitions directory not found: {}", configDir.getAbsolutePath());
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;

        for (File file : yamlFiles) {
            try {
                PipelineDefinition definition = parse(file);
                definitions.put(definition.getName(), definition);
                log.info("Loaded pipeline definition '{}' with stages {}", definition.getName(), definition.stageNames());
            } catch (IOException | PipelineDefinitionException e) {
                log.error("Failed to load pipeline definition from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public PipelineDefinition parse(File file) throws IOException {
        PipelineDefinition definition = yamlMapper.readValue(file, PipelineDefinition.class);
        if (definition.getName() == null || definition.getName().isBlank()) {
            String fileName = file.getName();
            definition.setName(fileName.substring(0, fileName.lastIndexOf('.')));
        }
        validate(definition);
        return definition;
    }

    public Optional<PipelineDefinition> getDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public PipelineDefinition requireDefinition(String name) {
        return getDefinition(name)
            .orElseThrow(() -> new PipelineDefinitionException("Unknown pipeline definition: " + name));
    }

    public Map<String, PipelineDefinition> getAllDefinitions() {
        return Map.copyOf(definitions);
    }

    public static void validate(PipelineDefinition definition) {
        if (definition.getStages() == null || definition.getStages().isEmpty()) {
            throw new PipelineDefinitionException("Pipeline '" + definition.getName() + "' declares no stages");
        }

        Set<String> seen = new HashSet<>();
        for (StageDefinition stage : definition.getStages()) {
            String name = stage.getName();
            if (name == null || name.isBlank()) {
                throw new PipelineDefinitionException("Pipeline '" + definition.getName() + "' has a stage without a name");
            }
            if (name.contains("/") || name.contains("\\") || name.contains("..")) {
                throw new PipelineDefinitionException("Stage name " + name + " must not contain path separators or '..'");
            }
            if (stage.getMarkerName() != null && stage.getMarkerName().contains("..")) {
                throw new PipelineDefinitionException("Marker of stage " + name + " must stay inside the working directory");
            }
            if (!seen.add(name)) {
                throw new PipelineDefinitionException("Pipeline '" + definition.getName() + "' repeats stage " + name);
            }
            if (stage.getCommand() == null || stage.getCommand().isEmpty()) {
                throw new PipelineDefinitionException("Stage " + name + " has no command");
            }
            Duration timeout = stage.resolveTimeout();
            if (timeout.isNegative() || timeout.isZero()) {
                throw new PipelineDefinitionException("Stage " + name + " needs a positive timeout");
            }
            if (stage.getMaxAttempts() < 1) {
                throw new PipelineDefinitionException("Stage " + name + " needs max_attempts of at least 1");
            }
        }
    }
}
