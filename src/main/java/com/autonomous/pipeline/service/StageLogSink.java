package com.autonomous.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only log file for one stage, fed by the process output pump.
 *
 * {@link #accept} never blocks: lines go into a bounded queue drained by a writer thread, and when
 * the queue is full the line is dropped and counted. The child process therefore can never stall
 * on a slow disk.
 */
public class StageLogSink implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StageLogSink.class);

    private static final String END_OF_STREAM = new String("<end-of-stream>");

    private final Path logFile;
    private final BlockingQueue<String> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final Thread writer;
    private volatile boolean closed = false;

    public StageLogSink(Path logFile, int capacity) {
        this.logFile = logFile;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.writer = new Thread(this::drain, "stage-log-" + logFile.getFileName());
        this.writer.setDaemon(true);
    }

    public StageLogSink start() {
        writer.start();
        return this;
    }

    public void accept(String line) {
        if (closed) {
            return;
        }
        if (!queue.offer(line)) {
            if (dropped.incrementAndGet() == 1) {
                log.warn("Log sink for {} is falling behind, dropping output lines", logFile);
            }
        }
    }

    public long getDroppedLines() {
        return dropped.get();
    }

    public Path getLogFile() {
        return logFile;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            // Wait for room rather than drop the terminator
            while (!queue.offer(END_OF_STREAM, 100, TimeUnit.MILLISECONDS)) {
                if (!writer.isAlive()) break;
            }
            writer.join(TimeUnit.SECONDS.toMillis(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void drain() {
        try (BufferedWriter out = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            while (true) {
                String line = queue.take();
                if (line == END_OF_STREAM) {
                    break;
                }
                out.write(line);
                out.newLine();
                if (queue.isEmpty()) {
                    out.flush();
                }
            }
            long lost = dropped.get();
            if (lost > 0) {
                out.write("[log sink dropped " + lost + " lines]");
                out.newLine();
            }
        } catch (IOException e) {
            log.error("Failed writing stage log {}: {}", logFile, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
