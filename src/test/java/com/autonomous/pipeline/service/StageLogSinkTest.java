package com.autonomous.pipeline.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageLogSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteLinesInOrder() throws Exception {
        Path logFile = tempDir.resolve("gather.log");

        try (StageLogSink sink = new StageLogSink(logFile, 100).start()) {
            sink.accept("first");
            sink.accept("second");
            sink.accept("third");
        }

        assertEquals(List.of("first", "second", "third"), Files.readAllLines(logFile));
    }

    @Test
    void shouldDropLinesWhenQueueIsFullInsteadOfBlocking() throws Exception {
        Path logFile = tempDir.resolve("gather.log");
        StageLogSink sink = new StageLogSink(logFile, 2);

        // Writer not started yet, so nothing drains the queue
        for (int i = 1; i <= 5; i++) {
            sink.accept("line " + i);
        }
        assertEquals(3, sink.getDroppedLines());

        sink.start();
        sink.close();

        assertEquals(List.of("line 1", "line 2", "[log sink dropped 3 lines]"), Files.readAllLines(logFile));
    }

    @Test
    void shouldAppendToExistingLog() throws Exception {
        Path logFile = tempDir.resolve("gather.log");
        Files.writeString(logFile, "previous attempt\n");

        try (StageLogSink sink = new StageLogSink(logFile, 10).start()) {
            sink.accept("retry");
        }

        assertEquals(List.of("previous attempt", "retry"), Files.readAllLines(logFile));
    }

    @Test
    void shouldIgnoreLinesAfterClose() throws Exception {
        Path logFile = tempDir.resolve("gather.log");
        StageLogSink sink = new StageLogSink(logFile, 10).start();
        sink.accept("kept");
        sink.close();

        sink.accept("late");

        assertEquals(List.of("kept"), Files.readAllLines(logFile));
        assertEquals(0, sink.getDroppedLines());
    }
}
