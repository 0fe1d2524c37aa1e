package org.qbitspark.knowledgefoldersbackend.globeadvice;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.OperationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ValidationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeresponsebody.GlobeFailureResponseBuilder;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobeControllerAdvice {

    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<GlobeFailureResponseBuilder> handleItemNotFound(ItemNotFoundException ex) {
        log.info("Item not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<GlobeFailureResponseBuilder> handleValidationFailed(ValidationFailedException ex) {
        log.info("Validation failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GlobeFailureResponseBuilder> handleInvalidArguments(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "Request validation failed", fieldErrors);
    }

    // Stale versions, lock timeouts and deadlock victims
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<GlobeFailureResponseBuilder> handleConcurrentModification(ConcurrencyFailureException ex) {
        log.warn("Concurrent folder modification rejected: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Folder was modified concurrently, please retry", null);
    }

    @ExceptionHandler(OperationFailedException.class)
    public ResponseEntity<GlobeFailureResponseBuilder> handleOperationFailed(OperationFailedException ex) {
        log.error("Operation failed: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), null);
    }

    private ResponseEntity<GlobeFailureResponseBuilder> build(HttpStatus status, String message, Object data) {
        return new ResponseEntity<>(GlobeFailureResponseBuilder.failure(status, message, data), status);
    }
}
