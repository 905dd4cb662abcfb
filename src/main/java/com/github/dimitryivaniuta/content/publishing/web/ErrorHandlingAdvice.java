package com.github.dimitryivaniuta.content.publishing.web;

import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.service.ConcurrentPostModificationException;
import com.github.dimitryivaniuta.content.publishing.service.PostNotFoundException;
import com.github.dimitryivaniuta.content.publishing.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception mapping for HTTP APIs.
 */
@RestControllerAdvice
public class ErrorHandlingAdvice {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingAdvice.class);

    /**
     * Refused lifecycle events. The body lists what the post accepts instead.
     *
     * @param ex exception
     * @return problem detail with {@code currentStatus}, {@code event} and {@code allowedEvents}
     */
    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ProblemDetail> handleInvalidTransition(InvalidTransitionException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setTitle("Invalid lifecycle transition");
        pd.setProperty("currentStatus", ex.getCurrentStatus().name());
        pd.setProperty("event", ex.getEvent().name());
        pd.setProperty("allowedEvents", ex.getAllowedEvents().stream().map(Enum::name).toList());
        if (ex.isGuardRejection()) {
            pd.setProperty("guardReason", ex.getGuardReason());
        }
        return ResponseEntity.badRequest().body(pd);
    }

    @ExceptionHandler(PostNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(PostNotFoundException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        pd.setProperty("postId", ex.getPostId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(pd);
    }

    /**
     * Lost races with the scheduler or another request. Safe to reload and retry.
     *
     * @param ex exception
     * @return 409
     */
    @ExceptionHandler({ConcurrentPostModificationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ProblemDetail> handleConcurrentModification(RuntimeException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "The post was modified concurrently; reload it and retry the command.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(pd);
    }

    /**
     * Validation errors for request DTOs, one entry per rejected field.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fe -> fe.getDefaultMessage() == null ? "invalid value" : fe.getDefaultMessage(),
                        (first, second) -> first + "; " + second,
                        LinkedHashMap::new));
        String message = fieldErrors.size() == 1
                ? "Request field " + fieldErrors.keySet().iterator().next() + " is invalid"
                : fieldErrors.size() + " request fields are invalid";
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR", message, request.getRequestURI(), correlationId(), fieldErrors, Instant.now()));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(error("VALIDATION_ERROR", ex.getMessage(), request));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(error("MALFORMED_REQUEST", "Request body is missing or malformed", request));
    }

    /**
     * Missing or malformed command payload values.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(error("INVALID_ARGUMENT", ex.getMessage(), request));
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ProblemDetail> handleErrorResponseException(ErrorResponseException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(error("CONFLICT", "The request conflicts with stored data", request));
    }

    /**
     * Fallback.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("INTERNAL_ERROR", "Unexpected error; quote the correlation id when reporting it", request));
    }

    private static ErrorResponse error(String code, String message, HttpServletRequest request) {
        return ErrorResponse.of(code, message, request.getRequestURI(), correlationId());
    }

    private static String correlationId() {
        return MDC.get(CorrelationIdFilter.MDC_KEY);
    }
}
