package com.autonomous.pipeline.store;

import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.StageRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Keeps each run as one JSON document inside its working directory:
 * {@code <workDir>/.pipeline/pipeline_state.json}.
 *
 * Writes go to a temp file in the same directory, are forced to disk and then renamed over the
 * canonical file, so a reader sees either the previous record or the new one, never a mix.
 */
@Service
public class FileStateStore implements StateStore {

    public static final String STATE_DIR = ".pipeline";
    public static final String STATE_FILE = "pipeline_state.json";
    public static final String LOCK_FILE = "pipeline_state.lock";

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private final ObjectMapper mapper;

    public FileStateStore() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static Path stateDirectory(Path runLocation) {
        return runLocation.resolve(STATE_DIR);
    }

    public static Path stateFile(Path runLocation) {
        return stateDirectory(runLocation).resolve(STATE_FILE);
    }

    @Override
    public PipelineRun load(Path runLocation) {
        Path stateFile = stateFile(runLocation);
        byte[] content;
        try {
            if (!Files.exists(stateFile) || Files.size(stateFile) == 0) {
                throw new RunNotFoundException(runLocation);
            }
            content = Files.readAllBytes(stateFile);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read pipeline state " + stateFile, e);
        }

        PipelineRun run;
        try {
            run = mapper.readValue(content, PipelineRun.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptException("Pipeline state " + stateFile + " cannot be parsed: "
                + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read pipeline state " + stateFile, e);
        }

        verifyShape(run, stateFile);
        return run;
    }

    @Override
    public void save(Path runLocation, PipelineRun run) {
        Path stateDir = stateDirectory(runLocation);
        Path stateFile = stateDir.resolve(STATE_FILE);
        Path tempFile = null;

        try {
            Files.createDirectories(stateDir);
            run.setUpdatedAt(Instant.now());
            byte[] content = mapper.writeValueAsBytes(run);

            tempFile = Files.createTempFile(stateDir, STATE_FILE, ".tmp");
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            Files.move(tempFile, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            tempFile = null;
            syncDirectory(stateDir);
        } catch (IOException e) {
            throw new StateStoreException("Failed to persist pipeline state " + stateFile, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    @Override
    public PipelineRun initialize(Path runLocation, List<String> stageNames) {
        if (exists(runLocation)) {
            throw new RunAlreadyExistsException(runLocation);
        }
        if (stageNames == null || stageNames.isEmpty()) {
            throw new IllegalArgumentException("A pipeline run needs at least one stage");
        }

        PipelineRun run = PipelineRun.builder()
            .runId(UUID.randomUUID().toString())
            .createdAt(Instant.now())
            .currentStage(stageNames.get(0))
            .stages(stageNames.stream()
                .map(StageRecord::pending)
                .collect(Collectors.toList()))
            .build();

        save(runLocation, run);
        log.info("Initialized pipeline run {} in {} with stages {}", run.getRunId(), runLocation, stageNames);
        return run;
    }

    @Override
    public boolean exists(Path runLocation) {
        Path stateFile = stateFile(runLocation);
        try {
            return Files.exists(stateFile) && Files.size(stateFile) > 0;
        } catch (IOException e) {
            throw new StateStoreException("Failed to inspect pipeline state " + stateFile, e);
        }
    }

    @Override
    public RunLock lock(Path runLocation) {
        Path stateDir = stateDirectory(runLocation);
        Path lockFile = stateDir.resolve(LOCK_FILE);
        FileChannel channel = null;

        try {
            Files.createDirectories(stateDir);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new RunLockedException(runLocation);
            }
            return new FileRunLock(channel, lock, lockFile);
        } catch (OverlappingFileLockException e) {
            // Held by another orchestrator call in this JVM
            closeQuietly(channel);
            throw new RunLockedException(runLocation);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new StateStoreException("Failed to lock pipeline run " + lockFile, e);
        }
    }

    private void verifyShape(PipelineRun run, Path stateFile) {
        if (run == null || run.getRunId() == null || run.getStages() == null || run.getStages().isEmpty()) {
            throw new StateCorruptException("Pipeline state " + stateFile + " is missing its run id or stages");
        }
        for (StageRecord stage : run.getStages()) {
            if (stage.getName() == null || stage.getStatus() == null) {
                throw new StateCorruptException("Pipeline state " + stateFile + " has a stage without name or status");
            }
        }
        if (run.getVersion() > PipelineRun.CURRENT_VERSION) {
            throw new StateCorruptException("Pipeline state " + stateFile + " has unsupported version " + run.getVersion());
        }
    }

    private void syncDirectory(Path dir) {
        // Makes the rename itself durable; not supported on every platform
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", dir, e.getMessage());
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}: {}", file, e.getMessage());
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    private static final class FileRunLock implements RunLock {

        private final FileChannel channel;
        private final FileLock lock;
        private final Path lockFile;

        private FileRunLock(FileChannel channel, FileLock lock, Path lockFile) {
            this.channel = channel;
            this.lock = lock;
            this.lockFile = lockFile;
        }

        @Override
        public void close() {
            try {
                if (lock.isValid()) {
                    lock.release();
                }
                channel.close();
            } catch (IOException e) {
                throw new StateStoreException("Failed to release run lock " + lockFile, e);
            }
        }
    }
}
