package com.headcount.controller.rest;

import com.headcount.service.core.query.AnalysisValidationException;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    @ExceptionHandler(AnalysisValidationException.class)
    public ResponseEntity<ErrorPayload> handleInvalidAnalysis(AnalysisValidationException ex, WebRequest request) {
        List<String> allowed = ex.allowed().isEmpty() ? null : ex.allowed();
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.field(), allowed, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleBadRequest(IllegalArgumentException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, null, request);
    }

    /** A broken invariant inside the engine, never the caller's fault. */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorPayload> handleInternalState(IllegalStateException ex, WebRequest request) {
        log.error("Analysis failed with an internal error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal analysis error", null, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", null, null, request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorPayload> handleStoreFailure(DataAccessException ex, WebRequest request) {
        log.error("Analysis query failed against the record store", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Query execution failed", null, null, request);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, String field, List<String> allowed, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body =
                new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path, field, allowed);
        return ResponseEntity.status(status).body(body);
    }
}
