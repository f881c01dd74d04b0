package com.flamingo.ai.coursepipeline.domain.enums;

/** Processing status of an uploaded course material. */
public enum MaterialStatus {
  /** Uploaded, extraction not yet started. */
  PENDING,

  /** An extraction job is running for the material. */
  PROCESSING,

  /** Text extracted and persisted. */
  COMPLETED,

  /** Extraction failed after the queue exhausted its retries. */
  FAILED
}
