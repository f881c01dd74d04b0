package com.flamingo.ai.coursepipeline.exception;

import java.util.UUID;

/** Exception thrown when a chapter is not found. */
public class ChapterNotFoundException extends RuntimeException {

  private final UUID chapterId;

  public ChapterNotFoundException(UUID chapterId) {
    super("Chapter not found: " + chapterId);
    this.chapterId = chapterId;
  }

  public UUID getChapterId() {
    return chapterId;
  }
}
