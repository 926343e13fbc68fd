package com.delta.research.pipeline.api;

import com.delta.research.pipeline.service.EvidenceRequiredException;
import com.delta.research.pipeline.service.InvalidRunStateException;
import com.delta.research.pipeline.service.PlanLockedException;
import com.delta.research.pipeline.service.ResourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ResearchExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(PlanLockedException.class)
    public ResponseEntity<Map<String, String>> handlePlanLocked(PlanLockedException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "plan_locked", "message", ex.getMessage(), "run_id", ex.getRunId().toString()));
    }

    @ExceptionHandler(InvalidRunStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidRunStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "invalid_run_state", "message", ex.getMessage()));
    }

    @ExceptionHandler(EvidenceRequiredException.class)
    public ResponseEntity<Map<String, String>> handleEvidenceRequired(EvidenceRequiredException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "evidence_required", "message", ex.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "missing_header", "message", "Required header " + ex.getHeaderName() + " is missing"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
    }
}
