package com.acmeCables.proposalEngine.gateway.controller;

import com.acmeCables.proposalEngine.gateway.exception.NoActiveRunException;
import com.acmeCables.proposalEngine.gateway.exception.ProposalRunFailedException;
import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpNotFoundException;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the proposal gateway.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return respond(ErrorCode.VALIDATION_ERROR, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Request body is missing or malformed");
    }

    @ExceptionHandler(RfpValidationException.class)
    public ResponseEntity<ErrorResponse> handleRfpValidation(RfpValidationException ex) {
        log.warn("RFP validation failed: {}", ex.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(RfpNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RfpNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(ErrorCode.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(NoActiveRunException.class)
    public ResponseEntity<ErrorResponse> handleNoActiveRun(NoActiveRunException ex) {
        log.warn("Cancel rejected: {}", ex.getMessage());
        return respond(ErrorCode.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailable(UpstreamUnavailableException ex) {
        log.error("Upstream unavailable: {}", ex.getMessage());
        return respond(ErrorCode.UPSTREAM_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(ProposalRunFailedException.class)
    public ResponseEntity<ErrorResponse> handleRunFailed(ProposalRunFailedException ex) {
        ErrorCode code = ex.getErrorCode() != null ? ex.getErrorCode() : ErrorCode.INTERNAL_ERROR;
        log.error("Proposal run failed - correlationId: {}, code: {}, reason: {}", ex.getCorrelationId(), code, ex.getMessage());
        String message = code == ErrorCode.INTERNAL_ERROR ? "An unexpected error occurred" : ex.getMessage();
        return respond(code, message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getHttpStatus()).body(new ErrorResponse(code.name(), message));
    }

    record ErrorResponse(String code, String message) {}
}
