package com.flamingo.ai.coursepipeline.domain.enums;

/** Lifecycle status of a tracked job record. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
