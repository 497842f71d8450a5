package com.di.jobcost.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured {@link ErrorResponse}.
 *
 * <ul>
 *   <li>{@link UnknownResourceClassException} - 422, the job cannot be priced</li>
 *   <li>{@link IllegalArgumentException}, bean validation, unreadable body - 400</li>
 *   <li>{@link ConfigurationException} - 500, the service is missing a credential or the job its region</li>
 *   <li>anything else - 500</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownResourceClassException.class)
    public ResponseEntity<ErrorResponse> handleUnknownResourceClass(UnknownResourceClassException e) {
        log.warn("Rejected job with unknown resource class {}", e.getResourceClass());
        ErrorResponse body = buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e);
        body.addDetail("resourceClass", e.getResourceClass());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad job cost request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(buildErrorResponse(HttpStatus.BAD_REQUEST, e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        log.warn("Job cost request failed validation: {} error(s)", e.getErrorCount());
        ErrorResponse body = buildErrorResponse(HttpStatus.BAD_REQUEST, e);
        body.setMessage("Request validation failed");
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> body.addDetail(fe.getField(), fe.getDefaultMessage()));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled exception: {}", e.getClass().getSimpleName(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e));
    }

    private ErrorResponse buildErrorResponse(HttpStatus status, Throwable exception) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        String path = MDC.get("requestPath");
        response.setPath(path != null ? path : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());
        String requestId = MDC.get("requestId");
        if (requestId != null) {
            response.addDetail("requestId", requestId);
        }
        return response;
    }

    /**
     * Structured error body for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
