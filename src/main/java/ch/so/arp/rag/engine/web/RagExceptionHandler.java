package ch.so.arp.rag.engine.web;

import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import ch.so.arp.rag.engine.BackendUnavailableException;
import ch.so.arp.rag.engine.CorruptionException;
import ch.so.arp.rag.engine.InvalidRequestException;
import ch.so.arp.rag.engine.NotFoundException;

/**
 * Maps engine exceptions onto HTTP status codes with a JSON error body.
 */
@RestControllerAdvice
public class RagExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(InvalidRequestException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler({ MethodArgumentNotValidException.class, HandlerMethodValidationException.class,
            ConstraintViolationException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<ErrorResponse> malformedRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> backendUnavailable(BackendUnavailableException ex) {
        LOGGER.warn("Backend unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable", ex.getMessage());
    }

    @ExceptionHandler(CorruptionException.class)
    public ResponseEntity<ErrorResponse> corruption(CorruptionException ex) {
        LOGGER.error("Corrupt index data: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "corruption", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception ex) {
        LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                "An unexpected error occurred: " + ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
