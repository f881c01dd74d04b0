package com.flamingo.ai.coursepipeline.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MaterialNotFoundException.class)
  public ResponseEntity<ApiError> handleMaterialNotFound(
      MaterialNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("material_not_found");
    String errorId = generateErrorId();
    log.warn("Material not found [{}]: {}", errorId, ex.getMaterialId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MATERIAL_NOT_FOUND, "Material not found", request);
  }

  @ExceptionHandler(ChapterNotFoundException.class)
  public ResponseEntity<ApiError> handleChapterNotFound(
      ChapterNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("chapter_not_found");
    String errorId = generateErrorId();
    log.warn("Chapter not found [{}]: {}", errorId, ex.getChapterId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.CHAPTER_NOT_FOUND, "Chapter not found", request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());

    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(DuplicateJobException.class)
  public ResponseEntity<ApiError> handleDuplicateJob(
      DuplicateJobException ex, HttpServletRequest request) {

    incrementErrorCounter("duplicate_job");
    String errorId = generateErrorId();
    log.warn(
        "Duplicate job [{}]: key={}, existing={}",
        errorId,
        ex.getDedupeKey(),
        ex.getExistingJobId());

    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.DUPLICATE_JOB, ex.getUserMessage(), request);
  }

  @ExceptionHandler(InvalidMaterialStateException.class)
  public ResponseEntity<ApiError> handleInvalidMaterialState(
      InvalidMaterialStateException ex, HttpServletRequest request) {

    incrementErrorCounter("material_state_conflict");
    String errorId = generateErrorId();
    log.warn("Material state conflict [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.MATERIAL_STATE_CONFLICT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(UnsupportedFormatException.class)
  public ResponseEntity<ApiError> handleUnsupportedFormat(
      UnsupportedFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_format");
    String errorId = generateErrorId();
    log.warn("Unsupported format [{}]: {}", errorId, ex.getMimeType());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.UNSUPPORTED_FORMAT, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MaterialProcessingException.class)
  public ResponseEntity<ApiError> handleMaterialProcessing(
      MaterialProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("material_processing");
    String errorId = generateErrorId();
    log.error("Material processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.MATERIAL_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmbeddingServiceUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingServiceUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding service error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(VectorStoreWriteException.class)
  public ResponseEntity<ApiError> handleVectorStore(
      VectorStoreWriteException ex, HttpServletRequest request) {

    incrementErrorCounter("vector_store_error");
    String errorId = generateErrorId();
    log.error("Vector store error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.VECTOR_STORE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("bad_request");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
