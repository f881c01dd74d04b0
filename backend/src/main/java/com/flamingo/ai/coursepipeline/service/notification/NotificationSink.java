package com.flamingo.ai.coursepipeline.service.notification;

/**
 * Delivery channel for pipeline events (push socket, email, persisted inbox). Implementations may
 * throw; callers never let a delivery failure reach the job.
 */
public interface NotificationSink {

  void deliver(PipelineEvent event);
}
