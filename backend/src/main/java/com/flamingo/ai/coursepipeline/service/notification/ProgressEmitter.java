package com.flamingo.ai.coursepipeline.service.notification;

import java.util.Map;
import java.util.UUID;

/**
 * One-way notifications about job and chapter progress. Calls never throw: delivery problems are
 * logged and counted, and the calling job carries on.
 */
public interface ProgressEmitter {

  void emitProgress(
      UUID userId, String jobId, int percentage, String stage, Map<String, Object> metadata);

  void emitComplete(UUID userId, String jobId, Map<String, Object> result);

  void emitFailed(UUID userId, String jobId, String errorMessage);

  /** Announces that every material of a chapter is processed and its content is merged. */
  void emitChapterReady(
      UUID userId, UUID courseId, UUID chapterId, String chapterTitle, String courseName);
}
