package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.PipelineOutcome;
import com.autonomous.pipeline.model.PipelineRun;
import com.autonomous.pipeline.model.StageRecord;
import com.autonomous.pipeline.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class LoggingPipelineEventListener implements PipelineEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineEventListener.class);

    @Override
    public void onStageStarted(PipelineRun run, StageRecord stage) {
        log.info("[{}] stage {} started (attempt {})", run.getRunId(), stage.getName(), stage.getAttemptCount());
    }

    @Override
    public void onStageFinished(PipelineRun run, StageRecord stage) {
        String elapsed = stage.getStartedAt() != null && stage.getCompletedAt() != null
            ? formatElapsed(Duration.between(stage.getStartedAt(), stage.getCompletedAt()))
            : "n/a";

        if (stage.getStatus() == StageStatus.FAILED) {
            log.error("[{}] stage {} failed after {}: {} (log: {})",
                run.getRunId(), stage.getName(), elapsed, stage.getError(), stage.getLogFile());
        } else {
            log.info("[{}] stage {} {} after {}", run.getRunId(), stage.getName(),
                stage.getStatus().name().toLowerCase(), elapsed);
        }
    }

    @Override
    public void onPipelineReturned(PipelineOutcome outcome) {
        switch (outcome.getStatus()) {
            case COMPLETED -> log.info("[{}] pipeline completed", outcome.getRunId());
            case AWAITING_APPROVAL -> log.info("[{}] pipeline paused for approval before stage {}",
                outcome.getRunId(), outcome.getRun().getCurrentStage());
            case FAILED -> log.error("[{}] pipeline halted at stage {}: {}",
                outcome.getRunId(), outcome.getFailedStage(), outcome.getError());
        }
    }

    static String formatElapsed(Duration elapsed) {
        return String.format("%.1fs (%.1f minutes)", elapsed.toMillis() / 1000.0, elapsed.toMillis() / 60000.0);
    }
}
