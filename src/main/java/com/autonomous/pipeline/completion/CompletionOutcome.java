package com.autonomous.pipeline.completion;

import java.util.Map;

/**
 * What the completion detector concluded about one supervised process.
 *
 * @param kind     how supervision ended
 * @param metadata key/value pairs parsed from the marker, empty unless {@code kind} is COMPLETED
 * @param exitCode exit code when the process exited without a marker, otherwise null
 */
public record CompletionOutcome(Kind kind, Map<String, String> metadata, Integer exitCode) {

    public enum Kind {
        COMPLETED,
        TIMED_OUT,
        PROCESS_EXITED_WITHOUT_MARKER,
        CANCELLED
    }

    public static CompletionOutcome completed(Map<String, String> metadata) {
        return new CompletionOutcome(Kind.COMPLETED, Map.copyOf(metadata), null);
    }

    public static CompletionOutcome timedOut() {
        return new CompletionOutcome(Kind.TIMED_OUT, Map.of(), null);
    }

    public static CompletionOutcome exitedWithoutMarker(int exitCode) {
        return new CompletionOutcome(Kind.PROCESS_EXITED_WITHOUT_MARKER, Map.of(), exitCode);
    }

    public static CompletionOutcome cancelled() {
        return new CompletionOutcome(Kind.CANCELLED, Map.of(), null);
    }
}
