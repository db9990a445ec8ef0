package com.flamingo.ai.docqa.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(NoActiveDocumentException.class)
  public ResponseEntity<ApiError> handleNoActiveDocument(
      NoActiveDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("no_active_document");
    String errorId = generateErrorId();
    log.warn("No active document [{}]", errorId);

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.NO_ACTIVE_DOCUMENT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(NoContextException.class)
  public ResponseEntity<ApiError> handleNoContext(
      NoContextException ex, HttpServletRequest request) {

    incrementErrorCounter("no_context");
    String errorId = generateErrorId();
    log.warn("No usable context [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.NO_CONTEXT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<ApiError> handleEmptyInput(
      EmptyInputException ex, HttpServletRequest request) {

    incrementErrorCounter("empty_input");
    String errorId = generateErrorId();
    log.warn("Empty input [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.EMPTY_INPUT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IndexBuildSupersededException.class)
  public ResponseEntity<ApiError> handleSuperseded(
      IndexBuildSupersededException ex, HttpServletRequest request) {

    incrementErrorCounter("build_superseded");
    String errorId = generateErrorId();
    log.warn("Index build superseded [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.BUILD_SUPERSEDED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CapabilityUnavailableException.class)
  public ResponseEntity<ApiError> handleCapabilityUnavailable(
      CapabilityUnavailableException ex, HttpServletRequest request) {

    boolean embedding = ex instanceof EmbeddingUnavailableException;
    incrementErrorCounter(embedding ? "embedding_unavailable" : "generation_unavailable");
    String errorId = generateErrorId();
    log.error(
        "AI capability error [{}] (timedOut={}): {}",
        errorId,
        ex.isTimedOut(),
        ex.getMessage(),
        ex);

    String code = embedding ? ApiError.EMBEDDING_UNAVAILABLE : ApiError.GENERATION_UNAVAILABLE;
    return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(IncompatibleIndexException.class)
  public ResponseEntity<ApiError> handleIncompatibleIndex(
      IncompatibleIndexException ex, HttpServletRequest request) {

    incrementErrorCounter("incompatible_index");
    String errorId = generateErrorId();
    log.error("Incompatible index [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INCOMPATIBLE_INDEX,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(DocumentValidationException.class)
  public ResponseEntity<ApiError> handleDocumentValidation(
      DocumentValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_UPLOAD,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(TextExtractionException.class)
  public ResponseEntity<ApiError> handleTextExtraction(
      TextExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("text_extraction");
    String errorId = generateErrorId();
    log.error("Text extraction failed [{}] for {}: {}", errorId, ex.getFileName(), ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.TEXT_EXTRACTION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_UPLOAD,
        "File too large. Maximum size is 10MB",
        request);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiError> handleMissingPart(
      MissingServletRequestPartException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_UPLOAD,
        "Missing required part: " + ex.getRequestPartName(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
