package com.flamingo.ai.coursepipeline.domain.enums;

/** Kinds of asynchronous work handled by the job queue. */
public enum JobType {
  EXTRACTION("extract"),
  EMBEDDING_GENERATION("embed");

  private final String keyPrefix;

  JobType(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  /** Prefix used for job ids and dedupe keys of this type. */
  public String getKeyPrefix() {
    return keyPrefix;
  }
}
