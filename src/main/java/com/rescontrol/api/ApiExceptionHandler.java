package com.rescontrol.api;

import com.rescontrol.admission.DuplicateUsageException;
import com.rescontrol.admission.ResourceUnauthorizedException;
import com.rescontrol.admission.ResourceUnavailableException;
import com.rescontrol.contract.ContractViolationException;
import com.rescontrol.contract.NotFoundException;
import com.rescontrol.lock.LockTimeoutException;
import com.rescontrol.store.ResourceStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "RESOURCE_UNAVAILABLE",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * Retryable failures also carry {@code "retryable": true}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ContractViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleContractViolation(ContractViolationException ex) {
        log.warn("Contract violation: {}", ex.getMessage());
        return errorResponse("CONTRACT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(ResourceUnauthorizedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleUnauthorized(ResourceUnauthorizedException ex) {
        return errorResponse("RESOURCE_UNAUTHORIZED", ex.getMessage());
    }

    @ExceptionHandler(ResourceUnavailableException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleUnavailable(ResourceUnavailableException ex) {
        return errorResponse("RESOURCE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(DuplicateUsageException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateUsage(DuplicateUsageException ex) {
        log.warn("Duplicate usage: {}", ex.getMessage());
        return errorResponse("DUPLICATE_USAGE", ex.getMessage());
    }

    @ExceptionHandler(LockTimeoutException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleLockTimeout(LockTimeoutException ex) {
        log.warn("Lock timeout: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("SERVER_ERROR", ex.getMessage());
        body.put("retryable", true);
        return body;
    }

    @ExceptionHandler(ResourceStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStoreFailure(ResourceStoreException ex) {
        log.error("Resource store failure: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("SERVER_ERROR", ex.getMessage());
        body.put("retryable", true);
        return body;
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
