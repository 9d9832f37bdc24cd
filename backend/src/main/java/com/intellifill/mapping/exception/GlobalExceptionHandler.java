package com.intellifill.mapping.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(InvalidJobSchemaException.class)
  public ResponseEntity<ErrorResponse> handleInvalidJobSchema(
      InvalidJobSchemaException ex, WebRequest request) {
    log.warn("Rejected mapping job: {}", ex.getMessage());
    ErrorResponse errorResponse =
        baseResponse(HttpStatus.BAD_REQUEST, "Invalid mapping job", request)
            .problems(ex.getProblems())
            .build();
    return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleJobNotFound(
      JobNotFoundException ex, WebRequest request) {
    log.warn("Job lookup failed: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(CheckpointStoreException.class)
  public ResponseEntity<ErrorResponse> handleCheckpointStore(
      CheckpointStoreException ex, WebRequest request) {
    log.error("Checkpoint store unavailable", ex);
    return buildErrorResponse(
        HttpStatus.SERVICE_UNAVAILABLE, "Job storage is temporarily unavailable", request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.error("Invalid argument: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new TreeMap<>();
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            error -> {
              String fieldName =
                  error instanceof FieldError
                      ? ((FieldError) error).getField()
                      : error.getObjectName();
              errors.put(fieldName, error.getDefaultMessage());
            });

    log.error("Validation failed: {}", errors);

    ErrorResponse errorResponse =
        baseResponse(HttpStatus.BAD_REQUEST, "Invalid request data", request)
            .error("Validation Failed")
            .validationErrors(errors)
            .build();
    return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Bad request: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed JSON request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);

    ErrorResponse.ErrorResponseBuilder builder =
        baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    if (debugEnabled && !"production".equals(environment)) {
      builder.debugMessage(ex.getMessage());
    }
    return new ResponseEntity<>(builder.build(), HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> buildErrorResponse(
      HttpStatus status, String message, WebRequest request) {
    return new ResponseEntity<>(baseResponse(status, message, request).build(), status);
  }

  private ErrorResponse.ErrorResponseBuilder baseResponse(
      HttpStatus status, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .message(message)
        .path(extractPath(request));
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Standard error response")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private List<String> problems;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
