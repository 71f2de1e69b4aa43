package com.tutornexus.availability.common.exception;

import com.tutornexus.availability.conflicts.exception.ConflictCheckFailedException;
import com.tutornexus.availability.slots.exception.SlotOpeningConflictException;
import com.tutornexus.availability.slots.exception.SlotSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Candidates could not be loaded; the client may retry
     */
    @ExceptionHandler(ConflictCheckFailedException.class)
    public ResponseEntity<ErrorResponse> handleConflictCheckFailed(ConflictCheckFailedException e) {
        log.error("Conflict check failed: {}", e.getCause() != null ? e.getCause().toString() : e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("CONFLICT_CHECK_FAILED", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    @ExceptionHandler(SlotOpeningConflictException.class)
    public ResponseEntity<ErrorResponse> handleSlotOpeningConflict(SlotOpeningConflictException e) {
        log.warn("Slot opening refused: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("SLOT_OVERLAPS_LESSON", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(SlotSyncException.class)
    public ResponseEntity<ErrorResponse> handleSlotSync(SlotSyncException e) {
        log.error("Slot sync failed: {}", e.getMessage(), e);
        ErrorResponse errorResponse = new ErrorResponse("SLOT_SYNC_FAILED", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * Unparsable dates/times and inconsistent ranges
     */
    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.error("Resource not found: {} {}", e.getHttpMethod(), e.getResourcePath());
        ErrorResponse errorResponse = new ErrorResponse("NOT_FOUND",
                "No endpoint " + e.getHttpMethod() + " " + e.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * @Valid failures
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> response = new HashMap<>();
        Map<String, String> errors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        response.put("errorCode", "INVALID_REQUEST");
        response.put("message", "Request validation failed");
        response.put("errors", errors);

        log.warn("Validation failed: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse("INTERNAL_SERVER_ERROR", "Internal server error");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
