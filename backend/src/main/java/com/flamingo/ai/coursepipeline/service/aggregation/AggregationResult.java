package com.flamingo.ai.coursepipeline.service.aggregation;

import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import java.util.UUID;

/**
 * Outcome of recomputing a chapter's status.
 *
 * @param chapterId the chapter
 * @param previous status before aggregation
 * @param current status after aggregation
 * @param materialCount number of materials in the chapter
 */
public record AggregationResult(
    UUID chapterId, ChapterStatus previous, ChapterStatus current, int materialCount) {

  public boolean changed() {
    return previous != current;
  }

  public boolean becameReady() {
    return current == ChapterStatus.READY && previous != ChapterStatus.READY;
  }
}
