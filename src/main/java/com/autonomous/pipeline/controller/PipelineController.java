package com.autonomous.pipeline.controller;

import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.RunSubmission;
import com.autonomous.pipeline.model.StageStatus;
import com.autonomous.pipeline.service.PipelineSubmissionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/pipeline")
public class PipelineController {

    @Autowired
    private PipelineSubmissionService submissions;

    @PostMapping("/runs")
    public ResponseEntity<?> startRun(@RequestBody Map<String, Object> payload) {
        RunSubmission submission = submissions.submitStart(
            workDir(payload), required(payload, "pipeline"), skipStages(payload));
        return accepted(submission);
    }

    @PostMapping("/runs/resume")
    public ResponseEntity<?> resumeRun(@RequestBody Map<String, Object> payload) {
        return accepted(submissions.submitResume(workDir(payload), required(payload, "pipeline")));
    }

    @PostMapping("/runs/approve")
    public ResponseEntity<?> approveRun(@RequestBody Map<String, Object> payload) {
        return accepted(submissions.submitApprove(workDir(payload), required(payload, "pipeline")));
    }

    @PostMapping("/runs/reject")
    public ResponseEntity<?> rejectRun(@RequestBody Map<String, Object> payload) {
        Object reason = payload.get("reason");
        PipelineOutcome outcome = submissions.reject(workDir(payload), reason != null ? reason.toString() : null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", outcome.getRunId());
        body.put("status", outcome.getStatus().name().toLowerCase());
        body.put("failed_stage", outcome.getFailedStage());
        body.put("error", outcome.getError());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/runs/abort")
    public ResponseEntity<?> abortRun(@RequestBody Map<String, Object> payload) {
        Object reason = payload.get("reason");
        boolean aborted = submissions.abort(workDir(payload), reason != null ? reason.toString() : null);
        return ResponseEntity.ok(Map.of(
            "aborted", aborted,
            "message", aborted ? "Abort requested." : "No stage running to abort."
        ));
    }

    @PostMapping("/runs/skip")
    public ResponseEntity<?> skipStage(@RequestBody Map<String, Object> payload) {
        return ResponseEntity.ok(submissions.skipStage(workDir(payload), required(payload, "stage")));
    }

    @GetMapping("/runs/status")
    public ResponseEntity<?> status(@RequestParam("work_dir") String workDir) {
        Path location = Path.of(workDir);
        PipelineRun run = submissions.status(location);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", submissions.hasActiveRun(location));
        body.put("stages_completed", run.countStages(StageStatus.COMPLETED));
        body.put("stages_total", run.getStages().size());
        body.put("run", run);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    private ResponseEntity<?> accepted(RunSubmission submission) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "submission_id", submission.getSubmissionId(),
            "work_dir", submission.getWorkDir().toString(),
            "pipeline", submission.getPipeline(),
            "action", submission.getAction()
        ));
    }

    private static Path workDir(Map<String, Object> payload) {
        return Path.of(required(payload, "work_dir"));
    }

    private static String required(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return value.toString();
    }

    private static List<String> skipStages(Map<String, Object> payload) {
        Object value = payload.get("skip_stages");
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException("skip_stages must be a list of stage names");
        }
        return ((Collection<?>) value).stream()
            .map(String::valueOf)
            .toList();
    }
}
