package com.autonomous.pipeline.completion;

import com.autonomous.pipeline.model.StageCancellation;
import com.autonomous.pipeline.model.StageProcessHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkerFileCompletionSignalTest {

    private MarkerFileCompletionSignal signal;
    private final List<Process> processes = new ArrayList<>();

    @TempDir
    Path workDir;

    @BeforeEach
    void setUp() {
        signal = new MarkerFileCompletionSignal(50);
    }

    @AfterEach
    void tearDown() {
        processes.forEach(Process::destroyForcibly);
    }

    @Test
    void shouldReportCompletionWhenMarkerAppears() throws Exception {
        StageProcessHandle handle = spawn("sleep 0.3; echo 'papers=12' > .gather_complete; sleep 30");

        CompletionOutcome outcome = signal.awaitCompletion(handle, workDir, ".gather_complete",
            Instant.now().plusSeconds(10));

        assertEquals(CompletionOutcome.Kind.COMPLETED, outcome.kind());
        assertEquals(Map.of("papers", "12"), outcome.metadata());
    }

    @Test
    void shouldNoticeExitWithoutWaitingForDeadline() throws Exception {
        StageProcessHandle handle = spawn("exit 3");
        signal = new MarkerFileCompletionSignal(60_000);

        long started = System.nanoTime();
        CompletionOutcome outcome = signal.awaitCompletion(handle, workDir, ".gather_complete",
            Instant.now().plusSeconds(120));

        assertEquals(CompletionOutcome.Kind.PROCESS_EXITED_WITHOUT_MARKER, outcome.kind());
        assertEquals(3, outcome.exitCode());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 10);
    }

    @Test
    void shouldCountMarkerWrittenJustBeforeExit() throws Exception {
        StageProcessHandle handle = spawn("touch .gather_complete; exit 0");

        CompletionOutcome outcome = signal.awaitCompletion(handle, workDir, ".gather_complete",
            Instant.now().plusSeconds(10));

        assertEquals(CompletionOutcome.Kind.COMPLETED, outcome.kind());
        assertTrue(outcome.metadata().isEmpty());
    }

    @Test
    void shouldTimeOutWhenNoMarkerArrives() throws Exception {
        StageProcessHandle handle = spawn("sleep 30");

        CompletionOutcome outcome = signal.awaitCompletion(handle, workDir, ".gather_complete",
            Instant.now().plusMillis(300));

        assertEquals(CompletionOutcome.Kind.TIMED_OUT, outcome.kind());
        assertTrue(handle.isAlive());
    }

    @Test
    void shouldStopWhenCancelled() throws Exception {
        StageProcessHandle handle = spawn("sleep 30");
        handle.getCancellation().cancel("operator abort");

        CompletionOutcome outcome = signal.awaitCompletion(handle, workDir, ".gather_complete",
            Instant.now().plusSeconds(10));

        assertEquals(CompletionOutcome.Kind.CANCELLED, outcome.kind());
    }

    @Test
    void shouldParseJsonMarkerMetadata() throws Exception {
        Path marker = workDir.resolve(".execute_complete");
        Files.writeString(marker, "{\"status\": \"ok\", \"experiments\": 3, \"notes\": null}");

        Map<String, String> metadata = signal.readMetadata(marker);

        assertEquals(Map.of("status", "ok", "experiments", "3"), metadata);
    }

    @Test
    void shouldParseKeyValueMarkerMetadata() throws Exception {
        Path marker = workDir.resolve(".execute_complete");
        Files.writeString(marker, "status: ok\nexperiments=3\nfree text line\n");

        Map<String, String> metadata = signal.readMetadata(marker);

        assertEquals(Map.of("status", "ok", "experiments", "3"), metadata);
    }

    @Test
    void shouldRejectNonPositivePollInterval() {
        assertThrows(IllegalArgumentException.class, () -> new MarkerFileCompletionSignal(0));
    }

    private StageProcessHandle spawn(String script) throws Exception {
        Process process = new ProcessBuilder("sh", "-c", script)
            .directory(workDir.toFile())
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .start();
        processes.add(process);
        return StageProcessHandle.builder()
            .stageName("gather")
            .pid(process.pid())
            .startedAt(Instant.now())
            .process(process)
            .cancellation(new StageCancellation())
            .build();
    }
}
