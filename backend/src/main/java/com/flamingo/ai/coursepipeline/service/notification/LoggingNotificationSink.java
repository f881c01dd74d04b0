package com.flamingo.ai.coursepipeline.service.notification;

import lombok.extern.slf4j.Slf4j;

/** Fallback sink that writes events to the log when no delivery channel is configured. */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

  @Override
  public void deliver(PipelineEvent event) {
    if (PipelineEvent.JOB_PROGRESS.equals(event.getEventType())) {
      log.debug(
          "[{}] user={} job={} {}% {}",
          event.getEventType(),
          event.getUserId(),
          event.getJobId(),
          event.getProgress(),
          event.getStage());
      return;
    }
    log.info(
        "[{}] user={} job={} data={} error={}",
        event.getEventType(),
        event.getUserId(),
        event.getJobId(),
        event.getData(),
        event.getError());
  }
}
