package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSubmission {
    private String submissionId;
    private Path workDir;
    private String pipeline;
    private String action;  // START, RESUME, APPROVE
    private Instant submittedAt;
    private transient CompletableFuture<PipelineOutcome> future;
}
