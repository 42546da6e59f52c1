package com.practicetracker.tracker.controller;

import com.practicetracker.tracker.exception.ApiException;
import com.practicetracker.tracker.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Translates failures into {@code {"code": ..., "error": ...}} payloads.
 * Storage and unexpected errors are logged and reported without detail.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApi(ApiException ex) {
        return respond(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return respond(ErrorCode.CONFLICT, "Resource already exists");
    }

    @ExceptionHandler(EmptyResultDataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleMissingRow(EmptyResultDataAccessException ex) {
        return respond(ErrorCode.NOT_FOUND, "Not found");
    }

    // A non-numeric id can never name an existing action.
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return respond(ErrorCode.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoRoute(NoResourceFoundException ex) {
        return respond(ErrorCode.NOT_FOUND, "Not Found");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "Validation failed"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return respond(ErrorCode.BAD_REQUEST, msg);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(ErrorCode.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        String rid = UUID.randomUUID().toString();
        log.error("RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), ex);
        Map<String, Object> body = body(ErrorCode.INTERNAL, "Internal server error");
        body.put("request_id", rid);
        return ResponseEntity.status(ErrorCode.INTERNAL.getStatus()).body(body);
    }

    private static ResponseEntity<Map<String, Object>> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus()).body(body(code, message));
    }

    private static Map<String, Object> body(ErrorCode code, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code.name());
        m.put("error", message);
        return m;
    }
}
