package com.scholary.livefeed.api;

import com.scholary.livefeed.chunking.ChunkSchedulingException;
import com.scholary.livefeed.queue.QueueFullException;
import com.scholary.livefeed.supervisor.StreamAlreadyExistsException;
import com.scholary.livefeed.supervisor.StreamCapacityException;
import com.scholary.livefeed.supervisor.StreamNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

/**
 * Maps exceptions to JSON error bodies of the form {@code {timestamp, status, error, message,
 * path}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final Clock clock;

  public GlobalExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(StreamNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(
      StreamNotFoundException ex, WebRequest request) {
    return buildErrorResponse(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
  }

  @ExceptionHandler({StreamAlreadyExistsException.class, ChunkSchedulingException.class})
  public ResponseEntity<Map<String, Object>> handleConflict(
      RuntimeException ex, WebRequest request) {
    LOGGER.info("Conflict: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request);
  }

  @ExceptionHandler({StreamCapacityException.class, QueueFullException.class})
  public ResponseEntity<Map<String, Object>> handleCapacity(
      RuntimeException ex, WebRequest request) {
    LOGGER.warn("Capacity exceeded: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.TOO_MANY_REQUESTS, "Capacity Exceeded", ex.getMessage(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(
      IllegalArgumentException ex, WebRequest request) {
    LOGGER.warn("Validation error: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidBody(
      MethodArgumentNotValidException ex, WebRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex, WebRequest request) {
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, "Validation Error", "Malformed request body", request);
  }

  @ExceptionHandler({IOException.class, UncheckedIOException.class})
  public ResponseEntity<Map<String, Object>> handleIo(Exception ex, WebRequest request) {
    LOGGER.error("I/O error: {}", ex.getMessage(), ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR, "I/O Error", ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGlobalException(
      Exception ex, WebRequest request) {
    LOGGER.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "Internal Server Error",
        "An unexpected error occurred",
        request);
  }

  private ResponseEntity<Map<String, Object>> buildErrorResponse(
      HttpStatus status, String error, String message, WebRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", clock.instant().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", request.getDescription(false).replace("uri=", ""));
    return new ResponseEntity<>(body, status);
  }
}
