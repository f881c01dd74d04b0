package com.flamingo.ai.coursepipeline.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String MATERIAL_NOT_FOUND = "MATERIAL_001";
  public static final String MATERIAL_PROCESSING_ERROR = "MATERIAL_002";
  public static final String UNSUPPORTED_FORMAT = "MATERIAL_003";
  public static final String MATERIAL_STATE_CONFLICT = "MATERIAL_004";
  public static final String CHAPTER_NOT_FOUND = "CHAPTER_001";
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String DUPLICATE_JOB = "JOB_002";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String VECTOR_STORE_ERROR = "EMBEDDING_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
