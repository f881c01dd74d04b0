package com.flamingo.ai.coursepipeline.service.notification;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link ProgressEmitter} that hands events to the configured {@link NotificationSink}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationProgressEmitter implements ProgressEmitter {

  private static final int MAX_ERROR_LENGTH = 200;

  private final NotificationSink notificationSink;
  private final MeterRegistry meterRegistry;

  @Override
  public void emitProgress(
      UUID userId, String jobId, int percentage, String stage, Map<String, Object> metadata) {
    deliver(PipelineEvent.progress(userId, jobId, percentage, stage, metadata));
  }

  @Override
  public void emitComplete(UUID userId, String jobId, Map<String, Object> result) {
    deliver(PipelineEvent.complete(userId, jobId, result));
  }

  @Override
  public void emitFailed(UUID userId, String jobId, String errorMessage) {
    deliver(PipelineEvent.failed(userId, jobId, truncate(errorMessage)));
  }

  @Override
  public void emitChapterReady(
      UUID userId, UUID courseId, UUID chapterId, String chapterTitle, String courseName) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("courseId", courseId);
    data.put("chapterId", chapterId);
    data.put("chapterTitle", chapterTitle);
    data.put("courseName", courseName);
    data.put(
        "message",
        String.format(
            "Your materials for \"%s\" in %s have been processed and are ready for study.",
            chapterTitle, courseName));
    deliver(PipelineEvent.chapterReady(userId, data));
  }

  private void deliver(PipelineEvent event) {
    if (event.getUserId() == null) {
      log.debug("Dropping {} event without a recipient", event.getEventType());
      return;
    }
    try {
      notificationSink.deliver(event);
    } catch (Exception e) {
      meterRegistry
          .counter("notification.delivery.failure", "event_type", event.getEventType())
          .increment();
      log.warn(
          "Failed to deliver {} event to user {}: {}",
          event.getEventType(),
          event.getUserId(),
          e.getMessage());
    }
  }

  private static String truncate(String error) {
    if (error != null && error.length() > MAX_ERROR_LENGTH) {
      return error.substring(0, MAX_ERROR_LENGTH) + "...";
    }
    return error;
  }
}
