package com.flamingo.ai.coursepipeline.domain.enums;

/** Derived status of a chapter, recomputed from its materials. */
public enum ChapterStatus {
  /** No materials uploaded yet. */
  DRAFT,

  /** At least one material is not completed. */
  PROCESSING,

  /** Every material is completed and the merged content is available. */
  READY,

  /** Terminal mark set by the user; never overwritten by aggregation. */
  COMPLETED
}
