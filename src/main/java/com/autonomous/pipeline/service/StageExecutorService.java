package com.autonomous.pipeline.service;

import com.autonomous.pipeline.completion.CompletionOutcome;
import com.autonomous.pipeline.completion.CompletionSignal;
import com.autonomous.pipeline.model.StageCancellation;
import com.autonomous.pipeline.model.StageErrorKind;
import com.autonomous.pipeline.model.StageProcessHandle;
import com.autonomous.pipeline.model.StageRequest;
import com.autonomous.pipeline.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Supervises exactly one external agent process per call: launch, output capture, completion
 * detection, timeout and cancellation, and classification of the result.
 *
 * The executor never persists anything and never retries; it hands a {@link StageResult} back to
 * the orchestrator.
 */
@Service
public class StageExecutorService {

    private static final Logger log = LoggerFactory.getLogger(StageExecutorService.class);

    public static final String LOGS_DIR = "logs";

    private final CompletionSignal completionSignal;
    private final LogSanitizer sanitizer;

    @Value("${pipeline.executor.termination-grace-seconds:10}")
    private long terminationGraceSeconds = 10;

    @Value("${pipeline.executor.log-queue-capacity:10000}")
    private int logQueueCapacity = 10000;

    public StageExecutorService(CompletionSignal completionSignal, LogSanitizer sanitizer) {
        this.completionSignal = completionSignal;
        this.sanitizer = sanitizer;
    }

    public void setTerminationGrace(Duration grace) {
        this.terminationGraceSeconds = Math.max(0, grace.toSeconds());
    }

    public void setLogQueueCapacity(int capacity) {
        this.logQueueCapacity = capacity;
    }

    public Duration getTerminationGrace() {
        return Duration.ofSeconds(terminationGraceSeconds);
    }

    public StageResult runStage(StageRequest request, StageCancellation cancellation) {
        String stage = request.getStageName();
        Path workingDir = request.getWorkingDir();
        Instant startedAt = Instant.now();

        Path logFile;
        ProcessBuilder pb;
        try {
            Path logsDir = workingDir.resolve(LOGS_DIR);
            Files.createDirectories(logsDir);
            logFile = logsDir.resolve(stage + ".log");

            // A marker left by an earlier attempt must not count for this one
            Path marker = workingDir.resolve(request.getMarkerName());
            if (Files.deleteIfExists(marker)) {
                log.info("Removed stale completion marker {} before running stage {}", marker, stage);
            }

            pb = buildProcess(request, logsDir);
        } catch (IOException e) {
            return failure(request, startedAt, null, null, StageErrorKind.LAUNCH_FAILED,
                "could not prepare working directory: " + e.getMessage());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.error("Failed to launch stage {} ({}): {}", stage, request.getCommand(), e.getMessage());
            return failure(request, startedAt, logFile, null, StageErrorKind.LAUNCH_FAILED,
                "failed to launch " + request.getCommand().get(0) + ": " + e.getMessage());
        }

        StageProcessHandle handle = StageProcessHandle.builder()
            .stageName(stage)
            .pid(process.pid())
            .startedAt(startedAt)
            .timeout(request.getTimeout())
            .process(process)
            .cancellation(cancellation != null ? cancellation : new StageCancellation())
            .build();

        log.info("Launched stage {} (pid {}) in {} with timeout {}s, log {}",
            stage, handle.getPid(), workingDir, request.getTimeout().toSeconds(), logFile);

        try (StageLogSink sink = new StageLogSink(logFile, logQueueCapacity).start()) {
            Thread pump = startOutputPump(handle, sink);
            try {
                return supervise(request, handle, startedAt, logFile);
            } finally {
                terminate(handle);
                awaitPump(pump, stage);
            }
        }
    }

    private StageResult supervise(StageRequest request, StageProcessHandle handle, Instant startedAt, Path logFile) {
        String stage = request.getStageName();
        Instant deadline = startedAt.plus(request.getTimeout());

        CompletionOutcome outcome;
        try {
            outcome = completionSignal.awaitCompletion(handle, request.getWorkingDir(), request.getMarkerName(), deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Supervision of stage {} interrupted, terminating pid {}", stage, handle.getPid());
            terminate(handle);
            return failure(request, startedAt, logFile, exitCodeOf(handle), StageErrorKind.STAGE_CANCELLED,
                "stage supervision was interrupted");
        }

        switch (outcome.kind()) {
            case COMPLETED: {
                // Let the agent wind down on its own before stopping it
                awaitExit(handle, getTerminationGrace());
                terminate(handle);
                return verifyOutputs(request, startedAt, logFile, exitCodeOf(handle), outcome.metadata());
            }
            case TIMED_OUT: {
                log.warn("Stage {} exceeded timeout of {}s, terminating pid {}",
                    stage, request.getTimeout().toSeconds(), handle.getPid());
                terminate(handle);
                return failure(request, startedAt, logFile, exitCodeOf(handle), StageErrorKind.STAGE_TIMEOUT,
                    String.format("stage exceeded timeout of %dsec", request.getTimeout().toSeconds()));
            }
            case CANCELLED: {
                String reason = handle.getCancellation().getReason();
                log.warn("Stage {} cancelled ({}), terminating pid {}", stage, reason, handle.getPid());
                terminate(handle);
                return failure(request, startedAt, logFile, exitCodeOf(handle), StageErrorKind.STAGE_CANCELLED,
                    "stage cancelled: " + (reason != null ? reason : "no reason given"));
            }
            case PROCESS_EXITED_WITHOUT_MARKER:
            default: {
                int exitCode = outcome.exitCode() != null ? outcome.exitCode() : -1;
                if (request.isAllowExitCodeSuccess() && exitCode == 0) {
                    log.info("Stage {} exited 0 without marker; accepted by its exit-code contract", stage);
                    return verifyOutputs(request, startedAt, logFile, exitCode, Map.of());
                }
                log.warn("Stage {} exited with code {} without writing {}", stage, exitCode, request.getMarkerName());
                return failure(request, startedAt, logFile, exitCode, StageErrorKind.PROCESS_EXITED_WITHOUT_MARKER,
                    String.format("process exited with code %d without writing completion marker %s",
                        exitCode, request.getMarkerName()));
            }
        }
    }

    /**
     * The marker is the agent's own claim of completion; the declared outputs are checked separately.
     */
    private StageResult verifyOutputs(StageRequest request, Instant startedAt, Path logFile,
                                      Integer exitCode, Map<String, String> metadata) {
        Map<String, String> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (Map.Entry<String, String> output : request.getRequiredOutputs().entrySet()) {
            Path path = request.getWorkingDir().resolve(output.getValue());
            if (Files.exists(path)) {
                found.put(output.getKey(), path.toAbsolutePath().toString());
            } else {
                missing.add(output.getKey() + " (" + output.getValue() + ")");
            }
        }

        if (!missing.isEmpty()) {
            log.warn("Stage {} reported completion but is missing outputs {}", request.getStageName(), missing);
            StageResult result = failure(request, startedAt, logFile, exitCode, StageErrorKind.STAGE_INCOMPLETE_OUTPUTS,
                "incomplete outputs: missing " + String.join(", ", missing));
            result.setMarkerMetadata(new LinkedHashMap<>(metadata));
            return result;
        }

        log.info("Stage {} completed with outputs {}", request.getStageName(), found.keySet());
        return StageResult.builder()
            .stageName(request.getStageName())
            .success(true)
            .startedAt(startedAt)
            .completedAt(Instant.now())
            .outputs(found)
            .exitCode(exitCode)
            .logFile(logFile.toString())
            .markerMetadata(new LinkedHashMap<>(metadata))
            .build();
    }

    private ProcessBuilder buildProcess(StageRequest request, Path logsDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(request.getCommand());
        pb.directory(request.getWorkingDir().toFile());
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        request.getStrippedEnvironment().forEach(env::remove);
        env.putAll(request.getEnvironment());

        if (request.getInput() != null) {
            Path inputFile = logsDir.resolve(request.getStageName() + "_input.txt");
            Files.writeString(inputFile, request.getInput(), StandardCharsets.UTF_8);
            pb.redirectInput(inputFile.toFile());
        } else {
            pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        }
        return pb;
    }

    private Thread startOutputPump(StageProcessHandle handle, StageLogSink sink) {
        Thread pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(handle.getProcess().getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(sanitizer.sanitize(line));
                }
            } catch (IOException e) {
                log.debug("Output stream of stage {} closed: {}", handle.getStageName(), e.getMessage());
            }
        }, "stage-output-" + handle.getStageName());
        pump.setDaemon(true);
        pump.start();
        return pump;
    }

    private void awaitPump(Thread pump, String stage) {
        try {
            pump.join(getTerminationGrace().toMillis() + 1000);
            if (pump.isAlive()) {
                // An orphaned grandchild still holds the pipe open
                log.warn("Output of stage {} still open after the process ended; detaching log capture", stage);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Graceful signal first, forceful kill after the grace period. Descendants are collected up
     * front so agents that spawn helpers do not outlive the stage.
     */
    void terminate(StageProcessHandle handle) {
        Process process = handle.getProcess();
        if (process == null) {
            return;
        }
        List<ProcessHandle> descendants = process.descendants().toList();
        if (!process.isAlive() && descendants.stream().noneMatch(ProcessHandle::isAlive)) {
            return;
        }

        process.destroy();
        descendants.forEach(ProcessHandle::destroy);

        if (!awaitExit(handle, getTerminationGrace())) {
            log.warn("Stage {} (pid {}) ignored termination for {}s, killing",
                handle.getStageName(), handle.getPid(), terminationGraceSeconds);
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            awaitExit(handle, Duration.ofSeconds(5));
        }
        descendants.stream()
            .filter(ProcessHandle::isAlive)
            .forEach(ProcessHandle::destroyForcibly);
    }

    private boolean awaitExit(StageProcessHandle handle, Duration grace) {
        try {
            return handle.getProcess().waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.getProcess().isAlive();
        }
    }

    private Integer exitCodeOf(StageProcessHandle handle) {
        Process process = handle.getProcess();
        return process != null && !process.isAlive() ? process.exitValue() : null;
    }

    private StageResult failure(StageRequest request, Instant startedAt, Path logFile, Integer exitCode,
                                StageErrorKind kind, String error) {
        return StageResult.builder()
            .stageName(request.getStageName())
            .success(false)
            .startedAt(startedAt)
            .completedAt(Instant.now())
            .error(error)
            .errorKind(kind)
            .exitCode(exitCode)
            .logFile(logFile != null ? logFile.toString() : null)
            .build();
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
