package com.flamingo.ai.coursepipeline.service.notification;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Event pushed to a user about the progress of their uploads. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineEvent {

  public static final String JOB_PROGRESS = "job:progress";
  public static final String JOB_COMPLETE = "job:complete";
  public static final String JOB_FAILED = "job:failed";
  public static final String CHAPTER_READY = "chapter:ready";

  /** Event type: job:progress, job:complete, job:failed, chapter:ready. */
  private String eventType;

  private UUID userId;

  /** Job the event belongs to; null for chapter events. */
  private String jobId;

  /** Percentage 0-100, only set on progress events. */
  private Integer progress;

  /** Stage name, e.g. {@code extracting} or {@code generating_embeddings}. */
  private String stage;

  private String error;

  /** Additional event data (JSON object). */
  private Map<String, Object> data;

  @Builder.Default private LocalDateTime timestamp = LocalDateTime.now();

  /** Creates a progress event. */
  public static PipelineEvent progress(
      UUID userId, String jobId, int progress, String stage, Map<String, Object> data) {
    return PipelineEvent.builder()
        .eventType(JOB_PROGRESS)
        .userId(userId)
        .jobId(jobId)
        .progress(progress)
        .stage(stage)
        .data(data != null ? data : Map.of())
        .build();
  }

  /** Creates a completion event carrying the job result. */
  public static PipelineEvent complete(UUID userId, String jobId, Map<String, Object> result) {
    return PipelineEvent.builder()
        .eventType(JOB_COMPLETE)
        .userId(userId)
        .jobId(jobId)
        .progress(100)
        .data(result != null ? result : Map.of())
        .build();
  }

  /** Creates a failure event. */
  public static PipelineEvent failed(UUID userId, String jobId, String error) {
    return PipelineEvent.builder()
        .eventType(JOB_FAILED)
        .userId(userId)
        .jobId(jobId)
        .error(error)
        .data(Map.of())
        .build();
  }

  /** Creates a chapter-ready event. */
  public static PipelineEvent chapterReady(UUID userId, Map<String, Object> data) {
    return PipelineEvent.builder()
        .eventType(CHAPTER_READY)
        .userId(userId)
        .data(data != null ? data : Map.of())
        .build();
  }
}
