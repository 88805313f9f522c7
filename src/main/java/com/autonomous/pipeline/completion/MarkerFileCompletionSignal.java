package com.autonomous.pipeline.completion;

import com.autonomous.pipeline.model.StageProcessHandle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Polls the working directory for the marker file an agent writes when it considers its task done.
 *
 * Exit codes are not trusted as a completion signal: interactive agent CLIs may exit 0 after doing
 * part of the work, or be killed from outside without a clean exit. Between polls the loop waits on
 * the process itself, so an exit is noticed immediately rather than on the next tick.
 */
@Component
public class MarkerFileCompletionSignal implements CompletionSignal {

    private static final Logger log = LoggerFactory.getLogger(MarkerFileCompletionSignal.class);

    private static final Pattern KEY_VALUE_PATTERN = Pattern.compile("^\\s*([\\w.-]+)\\s*[=:]\\s*(.*?)\\s*$");

    private final Duration pollInterval;
    private final ObjectMapper mapper = new ObjectMapper();

    public MarkerFileCompletionSignal(@Value("${pipeline.completion.poll-interval-ms:5000}") long pollIntervalMs) {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollIntervalMs);
        }
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
    }

    @Override
    public CompletionOutcome awaitCompletion(StageProcessHandle handle, Path workingDir, String markerName, Instant deadline)
            throws InterruptedException {
        Path marker = workingDir.resolve(markerName);
        Process process = handle.getProcess();

        while (true) {
            if (Files.exists(marker)) {
                log.info("Completion marker {} found for stage {}", marker, handle.getStageName());
                return CompletionOutcome.completed(readMetadata(marker));
            }

            if (handle.isCancelled()) {
                return CompletionOutcome.cancelled();
            }

            if (!process.isAlive()) {
                // A marker written just before exit still counts
                if (Files.exists(marker)) {
                    return CompletionOutcome.completed(readMetadata(marker));
                }
                return CompletionOutcome.exitedWithoutMarker(process.exitValue());
            }

            long remainingMs = Duration.between(Instant.now(), deadline).toMillis();
            if (remainingMs <= 0) {
                return CompletionOutcome.timedOut();
            }

            process.waitFor(Math.min(pollInterval.toMillis(), remainingMs), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Best effort: a JSON object, else {@code key=value} or {@code key: value} lines, else nothing.
     */
    Map<String, String> readMetadata(Path marker) {
        String content;
        try {
            content = Files.readString(marker, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.warn("Completion marker {} exists but could not be read: {}", marker, e.getMessage());
            return Map.of();
        }

        if (content.isEmpty()) {
            return Map.of();
        }

        if (content.startsWith("{")) {
            try {
                JsonNode node = mapper.readTree(content);
                if (node != null && node.isObject()) {
                    Map<String, String> metadata = new LinkedHashMap<>();
                    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        JsonNode value = field.getValue();
                        if (!value.isNull()) {
                            metadata.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
                        }
                    }
                    return metadata;
                }
            } catch (IOException e) {
                log.debug("Completion marker {} is not valid JSON, trying key/value lines", marker);
            }
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        for (String line : content.split("\\R")) {
            Matcher matcher = KEY_VALUE_PATTERN.matcher(line);
            if (matcher.matches()) {
                metadata.put(matcher.group(1), matcher.group(2));
            }
        }
        return metadata;
    }
}
