package com.heronix.attendance.controller.api;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.heronix.attendance.exception.AuthorizationDeniedException;
import com.heronix.attendance.exception.EnrollmentConflictException;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.InvalidStateTransitionException;
import com.heronix.attendance.exception.OperationNotPermittedException;
import com.heronix.attendance.exception.RecognitionServiceException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.SessionAlreadyExistsException;
import com.heronix.attendance.exception.SubmissionFailedException;
import com.heronix.attendance.exception.TimeWindowDeniedException;
import com.heronix.attendance.exception.TimetableLockedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps domain exceptions to JSON error bodies for all REST controllers.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    /**
     * Error body.
     */
    public record ApiError(
            int status,
            String error,
            String message,
            Map<String, Object> details
    ) {
        static ApiError of(HttpStatus status, String message, Map<String, Object> details) {
            return new ApiError(status.value(), status.getReasonPhrase(), message, details);
        }
    }

    @ExceptionHandler({InvalidRequestException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(f -> fields.put(f.getField(), f.getDefaultMessage()));
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", fields);
    }

    @ExceptionHandler(AuthorizationDeniedException.class)
    public ResponseEntity<ApiError> handleAuthorizationDenied(AuthorizationDeniedException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", e.getDecision().reason());
        if (e.getDecision().activatesOn() != null) {
            details.put("activatesOn", e.getDecision().activatesOn());
        }
        if (e.getDecision().endedOn() != null) {
            details.put("endedOn", e.getDecision().endedOn());
        }
        return respond(HttpStatus.FORBIDDEN, e.getMessage(), details);
    }

    @ExceptionHandler(TimeWindowDeniedException.class)
    public ResponseEntity<ApiError> handleTimeWindowDenied(TimeWindowDeniedException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (e.getCheck().minutesUntilOpen() != null) {
            details.put("minutesUntilOpen", e.getCheck().minutesUntilOpen());
        }
        return respond(HttpStatus.FORBIDDEN, e.getMessage(), details);
    }

    @ExceptionHandler(OperationNotPermittedException.class)
    public ResponseEntity<ApiError> handleNotPermitted(OperationNotPermittedException e) {
        return respond(HttpStatus.FORBIDDEN, e.getMessage(), Map.of());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), Map.of());
    }

    @ExceptionHandler({SessionAlreadyExistsException.class, TimetableLockedException.class,
            InvalidStateTransitionException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), Map.of());
    }

    @ExceptionHandler(EnrollmentConflictException.class)
    public ResponseEntity<ApiError> handleEnrollmentConflict(EnrollmentConflictException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (e.getReport() != null) {
            details.put("duplicates", e.getReport().duplicates());
            details.put("conflicts", e.getReport().conflicts());
            details.put("requiresConfirmation", e.isRequiresConfirmation());
        }
        return respond(HttpStatus.CONFLICT, e.getMessage(), details);
    }

    @ExceptionHandler(SubmissionFailedException.class)
    public ResponseEntity<ApiError> handleSubmissionFailed(SubmissionFailedException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(),
                Map.of("failureCount", e.getFailureCount()));
    }

    @ExceptionHandler(RecognitionServiceException.class)
    public ResponseEntity<ApiError> handleRecognitionUnavailable(RecognitionServiceException e) {
        log.error("Recognition service failure: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), Map.of());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(ApiError.of(status, message, details));
    }
}
