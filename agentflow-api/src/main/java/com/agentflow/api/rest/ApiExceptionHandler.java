package com.agentflow.api.rest;

import com.agentflow.core.exception.AgentFlowException;
import com.agentflow.core.exception.EngineShutdownException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkflowLoadException;
import com.agentflow.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps engine exceptions to {@code {errorCode, message, details}} responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WorkflowValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(WorkflowLoadException.class)
    public ResponseEntity<ErrorResponse> handleLoad(WorkflowLoadException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateTransitionException ex) {
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), List.of());
    }

    /**
     * Raised while the engine is shutting down.
     */
    @ExceptionHandler(EngineShutdownException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(EngineShutdownException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(AgentFlowException.class)
    public ResponseEntity<ErrorResponse> handleEngineError(AgentFlowException ex) {
        log.error("Engine error {}", ex.getErrorCode(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                  List<String> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message, details));
    }

    public record ErrorResponse(String errorCode, String message, List<String> details) {}
}
