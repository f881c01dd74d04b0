package com.flamingo.ai.coursepipeline.exception;

/** Exception thrown when a job with the same dedupe key is already pending or active. */
public class DuplicateJobException extends RuntimeException {

  private final String dedupeKey;
  private final String existingJobId;

  public DuplicateJobException(String dedupeKey, String existingJobId) {
    super("A job with dedupe key " + dedupeKey + " is already queued: " + existingJobId);
    this.dedupeKey = dedupeKey;
    this.existingJobId = existingJobId;
  }

  public String getDedupeKey() {
    return dedupeKey;
  }

  public String getExistingJobId() {
    return existingJobId;
  }

  public String getUserMessage() {
    return "This material is already being processed.";
  }
}
