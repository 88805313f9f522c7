package com.autonomous.pipeline.controller;

import com.autonomous.pipeline.service.PipelineDefinitionException;
import com.autonomous.pipeline.service.PipelineStateException;
import com.autonomous.pipeline.store.RunAlreadyExistsException;
import com.autonomous.pipeline.store.RunLockedException;
import com.autonomous.pipeline.store.RunNotFoundException;
import com.autonomous.pipeline.store.StateCorruptException;
import com.autonomous.pipeline.store.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps orchestrator and state store failures onto HTTP statuses for the control API.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<?> notFound(RunNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(RunAlreadyExistsException.class)
    public ResponseEntity<?> alreadyExists(RunAlreadyExistsException e) {
        return error(HttpStatus.CONFLICT, "already_exists", e);
    }

    @ExceptionHandler(RunLockedException.class)
    public ResponseEntity<?> locked(RunLockedException e) {
        return error(HttpStatus.CONFLICT, "run_locked", e);
    }

    @ExceptionHandler(PipelineStateException.class)
    public ResponseEntity<?> invalidState(PipelineStateException e) {
        return error(HttpStatus.CONFLICT, "invalid_state", e);
    }

    @ExceptionHandler({PipelineDefinitionException.class, IllegalArgumentException.class})
    public ResponseEntity<?> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e);
    }

    @ExceptionHandler(StateCorruptException.class)
    public ResponseEntity<?> corrupt(StateCorruptException e) {
        log.error("Corrupt pipeline state: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "state_corrupt", e);
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<?> storeFailure(StateStoreException e) {
        log.error("State store failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "state_store_error", e);
    }

    private ResponseEntity<?> error(HttpStatus status, String code, RuntimeException e) {
        return ResponseEntity.status(status).body(Map.of(
            "error", code,
            "message", String.valueOf(e.getMessage())
        ));
    }
}
